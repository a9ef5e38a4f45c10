package com.confer.mortgageServer.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * TRID compliance verdict for one LE/CD pair.
 *
 * Violations are kept in detection order: zero-tolerance lines, then the
 * 10% tolerance line, then the APR check.
 */
@Value
@Builder
public class ComplianceReport {

    @JsonProperty("is_compliant")
    boolean compliant;

    @JsonProperty("violations")
    @Singular
    List<Violation> violations;

    @JsonProperty("warnings")
    @Singular
    List<String> warnings;

    /**
     * Sum of positive deltas across zero-tolerance lines. Never negative.
     */
    @JsonProperty("zero_tolerance_diff")
    BigDecimal zeroToleranceDiff;

    @JsonProperty("ten_percent_diff")
    BigDecimal tenPercentDiff;

    @JsonProperty("ten_percent_limit")
    BigDecimal tenPercentLimit;

    @JsonProperty("summary")
    String summary;
}
