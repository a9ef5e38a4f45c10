package com.confer.mortgageServer.catalog.model;

import com.confer.mortgageServer.document.exception.DocumentValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Depth of a Loan Estimate analysis.
 */
public enum AnalysisType {

    /** Basic loan terms only. */
    QUICK("quick"),

    /** Full analysis with recommendations. */
    COMPREHENSIVE("comprehensive"),

    /** Focus on regulatory compliance. */
    COMPLIANCE("compliance");

    public static final AnalysisType DEFAULT = COMPREHENSIVE;

    private final String code;

    AnalysisType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @param code Wire code, or null for the default
     * @throws DocumentValidationException if the code is not one of the known types
     */
    public static AnalysisType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new DocumentValidationException("analysis_type",
                        "must be one of " + Arrays.stream(values()).map(AnalysisType::getCode).collect(Collectors.joining(", "))
                                + ", got '" + code + "'"));
    }
}
