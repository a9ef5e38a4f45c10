package com.confer.mortgageServer.document.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * MISMO-style Closing Disclosure with the final amounts for the transaction.
 */
@Value
@Builder
public class ClosingDisclosure implements MortgageDisclosure {

    @JsonProperty("loan_amount")
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    BigDecimal loanAmount;

    @JsonProperty("interest_rate")
    @NotNull
    @DecimalMin("0")
    @DecimalMax("100")
    BigDecimal interestRate;

    @JsonProperty("apr")
    @NotNull
    @DecimalMin("0")
    @DecimalMax("100")
    BigDecimal apr;

    @JsonProperty("monthly_payment")
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    BigDecimal monthlyPayment;

    @JsonProperty("origination_charges")
    @NotNull
    @DecimalMin("0")
    @Builder.Default
    BigDecimal originationCharges = BigDecimal.ZERO;

    @JsonProperty("services_cannot_shop")
    @NotNull
    @DecimalMin("0")
    @Builder.Default
    BigDecimal servicesCannotShop = BigDecimal.ZERO;

    @JsonProperty("services_can_shop")
    @NotNull
    @DecimalMin("0")
    @Builder.Default
    BigDecimal servicesCanShop = BigDecimal.ZERO;

    @JsonProperty("taxes_and_gov_fees")
    @NotNull
    @DecimalMin("0")
    @Builder.Default
    BigDecimal taxesAndGovFees = BigDecimal.ZERO;

    @JsonProperty("prepaids")
    @NotNull
    @DecimalMin("0")
    @Builder.Default
    BigDecimal prepaids = BigDecimal.ZERO;

    @JsonProperty("initial_escrow")
    @NotNull
    @DecimalMin("0")
    @Builder.Default
    BigDecimal initialEscrow = BigDecimal.ZERO;

    @JsonProperty("other_costs")
    @NotNull
    @DecimalMin("0")
    @Builder.Default
    BigDecimal otherCosts = BigDecimal.ZERO;

    // CD-specific fields

    @JsonProperty("cash_to_close")
    @NotNull
    BigDecimal cashToClose;

    /**
     * Closing date as printed on the disclosure (typically yyyy-MM-dd).
     */
    @JsonProperty("closing_date")
    String closingDate;

    @Override
    @JsonProperty("total_closing_costs")
    public BigDecimal getTotalClosingCosts() {
        return CostLine.total(this);
    }
}
