package com.confer.mortgageServer.document.service;

import com.confer.mortgageServer.compliance.service.ToleranceClassifier;
import com.confer.mortgageServer.document.exception.DocumentValidationException;
import com.confer.mortgageServer.document.model.ClosingDisclosure;
import com.confer.mortgageServer.document.model.CostLine;
import com.confer.mortgageServer.document.model.LoanEstimate;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Single construction boundary between untyped extractor output and the typed disclosures.
 *
 * Responsibilities:
 * - Coerce loosely-typed field values (numbers, numeric strings) to exact decimals
 * - Apply defaults for absent cost lines and metadata
 * - Enforce every range constraint declared on the models
 *
 * A document is either returned fully valid or a {@link DocumentValidationException}
 * naming the offending field is thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentFactory {

    private static final BigDecimal LARGE_LOAN_THRESHOLD = new BigDecimal("50000000");
    private static final int MAX_INTEGER_DIGITS = 15;
    private static final int MAX_FRACTION_DIGITS = 20;

    // Model property to wire field name, for constraint violations
    private static final Map<String, String> WIRE_NAMES = Map.ofEntries(
            Map.entry("loanAmount", "loan_amount"),
            Map.entry("interestRate", "interest_rate"),
            Map.entry("apr", "apr"),
            Map.entry("monthlyPayment", "monthly_payment"),
            Map.entry("originationCharges", CostLine.ORIGINATION_CHARGES.getFieldName()),
            Map.entry("servicesCannotShop", CostLine.SERVICES_CANNOT_SHOP.getFieldName()),
            Map.entry("servicesCanShop", CostLine.SERVICES_CAN_SHOP.getFieldName()),
            Map.entry("taxesAndGovFees", CostLine.TAXES_AND_GOV_FEES.getFieldName()),
            Map.entry("prepaids", CostLine.PREPAIDS.getFieldName()),
            Map.entry("initialEscrow", CostLine.INITIAL_ESCROW.getFieldName()),
            Map.entry("otherCosts", CostLine.OTHER_COSTS.getFieldName()),
            Map.entry("loanTermMonths", "loan_term_months"),
            Map.entry("toleranceBuckets", "tolerance_buckets"),
            Map.entry("cashToClose", "cash_to_close"));

    private final Validator validator;
    private final ToleranceClassifier toleranceClassifier;

    /**
     * Builds a Loan Estimate from extracted fields.
     *
     * @param fields Flat field map from the extractor
     * @return Validated Loan Estimate
     * @throws DocumentValidationException if a field is missing, mistyped or out of range
     */
    public LoanEstimate loanEstimate(Map<String, Object> fields) {
        LoanEstimate.LoanEstimateBuilder builder = LoanEstimate.builder()
                .loanAmount(decimal(fields, "loan_amount"))
                .interestRate(decimal(fields, "interest_rate"))
                .apr(decimal(fields, "apr"))
                .monthlyPayment(decimal(fields, "monthly_payment"))
                .lenderName(text(fields, "lender_name"))
                .propertyAddress(text(fields, "property_address"))
                .borrowerName(text(fields, "borrower_name"));

        applyCostLines(fields,
                builder::originationCharges,
                builder::servicesCannotShop,
                builder::servicesCanShop,
                builder::taxesAndGovFees,
                builder::prepaids,
                builder::initialEscrow,
                builder::otherCosts);

        Integer loanTermMonths = integer(fields, "loan_term_months");
        if (loanTermMonths != null) {
            builder.loanTermMonths(loanTermMonths);
        }

        Map<String, String> buckets = toleranceBuckets(fields);
        builder.toleranceBuckets(buckets.isEmpty() ? toleranceClassifier.canonicalAssignment() : buckets);

        LoanEstimate le = validated(builder.build(), LoanEstimate.class);

        if (le.getLoanAmount().compareTo(LARGE_LOAN_THRESHOLD) > 0) {
            log.warn("Large loan amount on Loan Estimate: {}", le.getLoanAmount().toPlainString());
        }
        return le;
    }

    /**
     * Builds a Closing Disclosure from extracted fields.
     *
     * @param fields Flat field map from the extractor
     * @return Validated Closing Disclosure
     * @throws DocumentValidationException if a field is missing, mistyped or out of range
     */
    public ClosingDisclosure closingDisclosure(Map<String, Object> fields) {
        ClosingDisclosure.ClosingDisclosureBuilder builder = ClosingDisclosure.builder()
                .loanAmount(decimal(fields, "loan_amount"))
                .interestRate(decimal(fields, "interest_rate"))
                .apr(decimal(fields, "apr"))
                .monthlyPayment(decimal(fields, "monthly_payment"))
                .cashToClose(decimal(fields, "cash_to_close"))
                .closingDate(text(fields, "closing_date"));

        applyCostLines(fields,
                builder::originationCharges,
                builder::servicesCannotShop,
                builder::servicesCanShop,
                builder::taxesAndGovFees,
                builder::prepaids,
                builder::initialEscrow,
                builder::otherCosts);

        return validated(builder.build(), ClosingDisclosure.class);
    }

    /**
     * Sets each present cost line through the matching setter, in {@link CostLine} order.
     * Absent lines keep the model default of zero.
     */
    @SafeVarargs
    private void applyCostLines(Map<String, Object> fields, Consumer<BigDecimal>... setters) {
        CostLine[] lines = CostLine.values();
        for (int i = 0; i < lines.length; i++) {
            BigDecimal amount = costLine(fields, lines[i]);
            if (amount != null) {
                setters[i].accept(amount);
            }
        }
    }

    private BigDecimal costLine(Map<String, Object> fields, CostLine line) {
        if (fields.get(line.getFieldName()) != null) {
            return decimal(fields, line.getFieldName());
        }
        for (String alias : line.getAliases()) {
            if (fields.get(alias) != null) {
                return decimal(fields, alias, line.getFieldName());
            }
        }
        return null;
    }

    private <T> T validated(T document, Class<T> type) {
        Set<ConstraintViolation<T>> violations = validator.validate(document);
        if (!violations.isEmpty()) {
            ConstraintViolation<T> first = violations.stream()
                    .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .orElseThrow();
            String field = wireName(first.getPropertyPath().toString());
            log.warn("{} rejected - field: {}, reason: {}", type.getSimpleName(), field, first.getMessage());
            throw new DocumentValidationException(field, first.getMessage());
        }
        return document;
    }

    private static String wireName(String property) {
        return WIRE_NAMES.getOrDefault(property, property);
    }

    private static BigDecimal decimal(Map<String, Object> fields, String key) {
        return decimal(fields, key, key);
    }

    private static BigDecimal decimal(Map<String, Object> fields, String key, String reportedAs) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        return withinDigitLimits(toDecimal(value, reportedAs), reportedAs);
    }

    private static BigDecimal toDecimal(Object value, String reportedAs) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            if (number instanceof Double || number instanceof Float) {
                double d = number.doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new DocumentValidationException(reportedAs, "must be a finite number");
                }
                return BigDecimal.valueOf(d);
            }
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            String cleaned = text.replace("$", "").replace(",", "").trim();
            try {
                return new BigDecimal(cleaned);
            } catch (NumberFormatException e) {
                throw new DocumentValidationException(reportedAs, "must be a number, got '" + text + "'");
            }
        }
        throw new DocumentValidationException(reportedAs, "must be a number");
    }

    /**
     * Bounds the digits on either side of the decimal point, so "1e-20000000" never reaches cost-line arithmetic.
     */
    private static BigDecimal withinDigitLimits(BigDecimal value, String reportedAs) {
        if (value.precision() > MAX_INTEGER_DIGITS + MAX_FRACTION_DIGITS) {
            throw digitLimitExceeded(reportedAs);
        }
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.scale() > MAX_FRACTION_DIGITS
                || (long) normalized.precision() - normalized.scale() > MAX_INTEGER_DIGITS) {
            throw digitLimitExceeded(reportedAs);
        }
        return value;
    }

    private static DocumentValidationException digitLimitExceeded(String reportedAs) {
        return new DocumentValidationException(reportedAs, "must have at most " + MAX_INTEGER_DIGITS
                + " integer digits and " + MAX_FRACTION_DIGITS + " decimal places");
    }

    private static Integer integer(Map<String, Object> fields, String key) {
        BigDecimal value = decimal(fields, key);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new DocumentValidationException(key, "must be a whole number");
        }
    }

    private static String text(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        return value == null ? null : value.toString();
    }

    private static Map<String, String> toleranceBuckets(Map<String, Object> fields) {
        Object value = fields.get("tolerance_buckets");
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new DocumentValidationException("tolerance_buckets", "must be a mapping of cost line to bucket");
        }
        Map<String, String> buckets = new LinkedHashMap<>();
        raw.forEach((line, bucket) -> {
            if (line == null || bucket == null) {
                throw new DocumentValidationException("tolerance_buckets", "must not contain null entries");
            }
            buckets.put(line.toString(), bucket.toString());
        });
        return Collections.unmodifiableMap(buckets);
    }
}
