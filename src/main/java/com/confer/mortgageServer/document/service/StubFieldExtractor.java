package com.confer.mortgageServer.document.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Placeholder extractor returning a fixed sample transaction.
 */
@Slf4j
@Service
public class StubFieldExtractor implements FieldExtractor {

    // TODO: replace with layout-based extraction once sample LE/CD PDFs are available

    @Override
    public Map<String, Object> extractLoanEstimate(byte[] pdfBytes) {
        log.debug("Extracting Loan Estimate fields (stub) - bytes: {}", pdfBytes.length);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("loan_amount", 300000.0);
        fields.put("interest_rate", 6.5);
        fields.put("apr", 6.73);
        fields.put("monthly_payment", 1896.20);
        fields.put("origination_charges", 1500.0);
        fields.put("services_borrower_cannot_shop", 800.0);
        fields.put("services_borrower_can_shop", 1200.0);
        fields.put("taxes_and_government_fees", 2500.0);
        fields.put("prepaids", 3000.0);
        fields.put("initial_escrow", 2400.0);
        fields.put("other_costs", 600.0);
        fields.put("lender_name", "Example Bank");
        fields.put("loan_term_months", 360);
        fields.put("tolerance_buckets", Map.of(
                "origination_charges", "zero",
                "services_borrower_cannot_shop", "zero",
                "services_borrower_can_shop", "10_percent"));
        return fields;
    }

    @Override
    public Map<String, Object> extractClosingDisclosure(byte[] pdfBytes) {
        log.debug("Extracting Closing Disclosure fields (stub) - bytes: {}", pdfBytes.length);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("loan_amount", 300000.0);
        fields.put("interest_rate", 6.5);
        fields.put("apr", 6.75);
        fields.put("monthly_payment", 1896.20);
        fields.put("origination_charges", 1500.0);
        fields.put("services_borrower_cannot_shop", 850.0);
        fields.put("services_borrower_can_shop", 1250.0);
        fields.put("taxes_and_government_fees", 2500.0);
        fields.put("prepaids", 3000.0);
        fields.put("initial_escrow", 2400.0);
        fields.put("other_costs", 600.0);
        fields.put("cash_to_close", 15000.0);
        fields.put("closing_date", "2025-06-15");
        return fields;
    }
}
