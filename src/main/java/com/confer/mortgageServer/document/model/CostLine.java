package com.confer.mortgageServer.document.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * The seven itemized closing-cost lines shared by the Loan Estimate and the Closing Disclosure.
 * Declaration order is the order used for reporting.
 */
public enum CostLine {

    ORIGINATION_CHARGES("origination_charges", "Origination Charges",
            List.of(), MortgageDisclosure::getOriginationCharges),
    SERVICES_CANNOT_SHOP("services_cannot_shop", "Services Borrower Cannot Shop",
            List.of("services_borrower_cannot_shop"), MortgageDisclosure::getServicesCannotShop),
    SERVICES_CAN_SHOP("services_can_shop", "Services Borrower Can Shop",
            List.of("services_borrower_can_shop"), MortgageDisclosure::getServicesCanShop),
    TAXES_AND_GOV_FEES("taxes_and_gov_fees", "Taxes and Government Fees",
            List.of("taxes_and_government_fees"), MortgageDisclosure::getTaxesAndGovFees),
    PREPAIDS("prepaids", "Prepaids",
            List.of(), MortgageDisclosure::getPrepaids),
    INITIAL_ESCROW("initial_escrow", "Initial Escrow Payment at Closing",
            List.of(), MortgageDisclosure::getInitialEscrow),
    OTHER_COSTS("other_costs", "Other Costs",
            List.of(), MortgageDisclosure::getOtherCosts);

    private final String fieldName;
    private final String displayName;
    private final List<String> aliases;
    private final Function<MortgageDisclosure, BigDecimal> accessor;

    CostLine(String fieldName, String displayName, List<String> aliases,
             Function<MortgageDisclosure, BigDecimal> accessor) {
        this.fieldName = fieldName;
        this.displayName = displayName;
        this.aliases = aliases;
        this.accessor = accessor;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Alternative field names emitted by extractors for this line.
     */
    public List<String> getAliases() {
        return aliases;
    }

    public BigDecimal amountOf(MortgageDisclosure disclosure) {
        return accessor.apply(disclosure);
    }

    /**
     * Sums all seven lines of a disclosure.
     */
    public static BigDecimal total(MortgageDisclosure disclosure) {
        BigDecimal total = BigDecimal.ZERO;
        for (CostLine line : values()) {
            total = total.add(line.amountOf(disclosure));
        }
        return total;
    }
}
