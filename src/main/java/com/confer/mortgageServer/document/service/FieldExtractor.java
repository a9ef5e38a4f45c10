package com.confer.mortgageServer.document.service;

import java.util.Map;

/**
 * Turns raw PDF bytes into the flat field map consumed by {@link DocumentFactory}.
 * Implementations are free to use any extraction technique; values are untrusted.
 */
public interface FieldExtractor {

    Map<String, Object> extractLoanEstimate(byte[] pdfBytes);

    Map<String, Object> extractClosingDisclosure(byte[] pdfBytes);
}
