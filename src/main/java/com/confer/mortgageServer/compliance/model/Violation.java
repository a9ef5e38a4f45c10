package com.confer.mortgageServer.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A single tolerance rule exceeded between the Loan Estimate and the Closing Disclosure.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Violation {

    @JsonProperty("type")
    ViolationType type;

    @JsonProperty("fee")
    String fee;

    @JsonProperty("le_amount")
    BigDecimal leAmount;

    @JsonProperty("cd_amount")
    BigDecimal cdAmount;

    /**
     * Dollars (fees) or percentage points (APR) beyond the allowed change.
     */
    @JsonProperty("amount_over")
    BigDecimal amountOver;

    /**
     * Allowed increase, set only for the 10% tolerance rule.
     */
    @JsonProperty("limit")
    BigDecimal limit;

    @JsonProperty("description")
    String description;
}
