package com.confer.mortgageServer.compliance.service;

import com.confer.mortgageServer.compliance.model.ToleranceBucket;
import com.confer.mortgageServer.document.model.CostLine;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Regulatory assignment of cost lines to TRID tolerance buckets.
 *
 * The table is fixed: upstream document metadata cannot change it.
 */
@Component
public class ToleranceClassifier {

    private static final Map<CostLine, ToleranceBucket> CANONICAL_BUCKETS;

    static {
        Map<CostLine, ToleranceBucket> buckets = new EnumMap<>(CostLine.class);
        buckets.put(CostLine.ORIGINATION_CHARGES, ToleranceBucket.ZERO_TOLERANCE);
        buckets.put(CostLine.SERVICES_CANNOT_SHOP, ToleranceBucket.ZERO_TOLERANCE);
        buckets.put(CostLine.SERVICES_CAN_SHOP, ToleranceBucket.TEN_PERCENT_TOLERANCE);
        buckets.put(CostLine.TAXES_AND_GOV_FEES, ToleranceBucket.UNLIMITED_TOLERANCE);
        buckets.put(CostLine.PREPAIDS, ToleranceBucket.UNLIMITED_TOLERANCE);
        buckets.put(CostLine.INITIAL_ESCROW, ToleranceBucket.UNLIMITED_TOLERANCE);
        buckets.put(CostLine.OTHER_COSTS, ToleranceBucket.UNLIMITED_TOLERANCE);
        CANONICAL_BUCKETS = Collections.unmodifiableMap(buckets);
    }

    public ToleranceBucket classify(CostLine line) {
        return CANONICAL_BUCKETS.get(line);
    }

    /**
     * Cost lines in the given bucket, in {@link CostLine} declaration order.
     */
    public List<CostLine> linesIn(ToleranceBucket bucket) {
        return Arrays.stream(CostLine.values())
                .filter(line -> CANONICAL_BUCKETS.get(line) == bucket)
                .collect(Collectors.toList());
    }

    /**
     * The canonical table keyed by wire field name, used as the advisory
     * {@code tolerance_buckets} default on a Loan Estimate.
     */
    public Map<String, String> canonicalAssignment() {
        Map<String, String> assignment = new LinkedHashMap<>();
        CANONICAL_BUCKETS.forEach((line, bucket) -> assignment.put(line.getFieldName(), bucket.getTag()));
        return Collections.unmodifiableMap(assignment);
    }
}
