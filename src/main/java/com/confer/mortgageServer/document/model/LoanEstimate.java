package com.confer.mortgageServer.document.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * MISMO-style Loan Estimate, the borrower's initial cost disclosure.
 * Instances are built only through {@code DocumentFactory} and are immutable.
 */
@Value
@Builder
public class LoanEstimate implements MortgageDisclosure {

    // Loan information

    @JsonProperty("loan_amount")
    @NotNull
    @DecimalMin(value = "1000", message = "Loan amount too small (< $1,000)")
    @DecimalMax(value = "100000000", inclusive = false, message = "must be less than 100,000,000")
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

    // Closing costs

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

    // Metadata

    @JsonProperty("lender_name")
    String lenderName;

    @JsonProperty("loan_term_months")
    @Min(1)
    @Max(480)
    @Builder.Default
    Integer loanTermMonths = 360;

    @JsonProperty("property_address")
    String propertyAddress;

    @JsonProperty("borrower_name")
    String borrowerName;

    /**
     * Cost-line name to bucket tag, for display only.
     * The compliance check never reads it.
     */
    @JsonProperty("tolerance_buckets")
    @NotNull
    @Builder.Default
    Map<String, String> toleranceBuckets = Map.of();

    @Override
    @JsonProperty("total_closing_costs")
    public BigDecimal getTotalClosingCosts() {
        return CostLine.total(this);
    }
}
