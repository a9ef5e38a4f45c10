package com.confer.mortgageServer.compliance.service;

import com.confer.mortgageServer.compliance.model.ComplianceReport;
import com.confer.mortgageServer.compliance.model.ToleranceBucket;
import com.confer.mortgageServer.compliance.model.Violation;
import com.confer.mortgageServer.compliance.model.ViolationType;
import com.confer.mortgageServer.document.model.ClosingDisclosure;
import com.confer.mortgageServer.document.model.CostLine;
import com.confer.mortgageServer.document.model.LoanEstimate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Compares a Loan Estimate against a Closing Disclosure under the TRID tolerance rules.
 *
 * Checks, in order:
 * - zero tolerance: no increase beyond a one-cent rounding allowance
 * - 10% tolerance: increase capped at 10% of the LE amount, warning above 80% of the cap
 * - APR accuracy: absolute change of at most 0.125 percentage points
 *
 * Unlimited-tolerance lines are never checked. The comparison is a pure function of its inputs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceComparator {

    static final BigDecimal ROUNDING_ALLOWANCE = new BigDecimal("0.01");
    static final BigDecimal TEN_PERCENT = new BigDecimal("0.10");
    static final BigDecimal WARNING_RATIO = new BigDecimal("0.8");
    static final BigDecimal APR_TOLERANCE = new BigDecimal("0.125");

    private final ToleranceClassifier toleranceClassifier;

    public ComplianceReport compare(LoanEstimate le, ClosingDisclosure cd) {
        ComplianceReport.ComplianceReportBuilder report = ComplianceReport.builder();
        int violationCount = 0;

        BigDecimal zeroToleranceDiff = BigDecimal.ZERO;
        for (CostLine line : toleranceClassifier.linesIn(ToleranceBucket.ZERO_TOLERANCE)) {
            BigDecimal leAmount = line.amountOf(le);
            BigDecimal cdAmount = line.amountOf(cd);
            BigDecimal delta = cdAmount.subtract(leAmount);
            zeroToleranceDiff = zeroToleranceDiff.add(delta.max(BigDecimal.ZERO));

            if (delta.compareTo(ROUNDING_ALLOWANCE) > 0) {
                report.violation(Violation.builder()
                        .type(ViolationType.ZERO_TOLERANCE)
                        .fee(line.getDisplayName())
                        .leAmount(leAmount)
                        .cdAmount(cdAmount)
                        .amountOver(delta)
                        .description(String.format("%s increased by $%s (zero tolerance - no increase allowed)",
                                line.getDisplayName(), money(delta)))
                        .build());
                violationCount++;
            }
        }

        // A single line carries the 10% bucket today; the loop keeps the aggregate
        // semantics should the table grow.
        BigDecimal tenPercentLe = BigDecimal.ZERO;
        BigDecimal tenPercentCd = BigDecimal.ZERO;
        String tenPercentFee = null;
        for (CostLine line : toleranceClassifier.linesIn(ToleranceBucket.TEN_PERCENT_TOLERANCE)) {
            tenPercentLe = tenPercentLe.add(line.amountOf(le));
            tenPercentCd = tenPercentCd.add(line.amountOf(cd));
            tenPercentFee = tenPercentFee == null ? line.getDisplayName() : tenPercentFee + ", " + line.getDisplayName();
        }
        BigDecimal tenPercentLimit = tenPercentLe.multiply(TEN_PERCENT);
        BigDecimal tenPercentDiff = tenPercentCd.subtract(tenPercentLe).max(BigDecimal.ZERO);

        if (tenPercentDiff.compareTo(tenPercentLimit) > 0) {
            BigDecimal over = tenPercentDiff.subtract(tenPercentLimit);
            report.violation(Violation.builder()
                    .type(ViolationType.TEN_PERCENT_TOLERANCE)
                    .fee(tenPercentFee)
                    .leAmount(tenPercentLe)
                    .cdAmount(tenPercentCd)
                    .amountOver(over)
                    .limit(tenPercentLimit)
                    .description(String.format("10%% tolerance exceeded by $%s", money(over)))
                    .build());
            violationCount++;
        } else if (tenPercentDiff.compareTo(tenPercentLimit.multiply(WARNING_RATIO)) > 0) {
            report.warning(String.format("%s increased by $%s, approaching 10%% limit of $%s",
                    tenPercentFee, money(tenPercentDiff), money(tenPercentLimit)));
        }

        BigDecimal aprDiff = cd.getApr().subtract(le.getApr()).abs();
        if (aprDiff.compareTo(APR_TOLERANCE) > 0) {
            report.violation(Violation.builder()
                    .type(ViolationType.APR_ACCURACY)
                    .fee("APR")
                    .leAmount(le.getApr())
                    .cdAmount(cd.getApr())
                    .amountOver(aprDiff.subtract(APR_TOLERANCE))
                    .description(String.format("APR changed by %s%% (max allowed: 0.125%%)", percent(aprDiff)))
                    .build());
            violationCount++;
        }

        boolean compliant = violationCount == 0;
        String summary = compliant
                ? String.format("COMPLIANT: Closing Disclosure is within TRID tolerance limits. "
                        + "Zero-tolerance items: $%s increase. "
                        + "10%% tolerance items: $%s increase (limit: $%s). "
                        + "APR change: %s%% (limit: 0.125%%).",
                        money(zeroToleranceDiff), money(tenPercentDiff), money(tenPercentLimit), percent(aprDiff))
                : String.format("NOT COMPLIANT: %d violation(s) found. Review required before closing.", violationCount);

        log.debug("Compliance comparison complete - compliant: {}, violations: {}, zeroToleranceDiff: {}, tenPercentDiff: {}, aprDiff: {}",
                compliant, violationCount, zeroToleranceDiff, tenPercentDiff, aprDiff);

        return report
                .compliant(compliant)
                .zeroToleranceDiff(zeroToleranceDiff)
                .tenPercentDiff(tenPercentDiff)
                .tenPercentLimit(tenPercentLimit)
                .summary(summary)
                .build();
    }

    private static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(BigDecimal points) {
        return points.setScale(3, RoundingMode.HALF_UP).toPlainString();
    }
}
