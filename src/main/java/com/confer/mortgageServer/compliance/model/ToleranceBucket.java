package com.confer.mortgageServer.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * TRID tolerance classes for closing-cost lines.
 */
public enum ToleranceBucket {

    /** May not increase at all between LE and CD. */
    ZERO_TOLERANCE("zero_tolerance"),

    /** Increase capped at 10% of the LE amount. */
    TEN_PERCENT_TOLERANCE("ten_percent_tolerance"),

    /** No cap on change. */
    UNLIMITED_TOLERANCE("unlimited_tolerance");

    private final String tag;

    ToleranceBucket(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
