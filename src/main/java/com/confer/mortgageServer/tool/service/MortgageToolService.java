package com.confer.mortgageServer.tool.service;

import com.confer.mortgageServer.common.exception.MortgageServerException;
import com.confer.mortgageServer.compliance.model.ComplianceReport;
import com.confer.mortgageServer.compliance.service.ComplianceComparator;
import com.confer.mortgageServer.document.model.ClosingDisclosure;
import com.confer.mortgageServer.document.model.LoanEstimate;
import com.confer.mortgageServer.document.model.MortgageDisclosure;
import com.confer.mortgageServer.document.service.DocumentLoader;
import com.confer.mortgageServer.ingestion.exception.TransportFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Mortgage document operations behind the tool boundary.
 *
 * Responsibilities:
 * - Connectivity greeting
 * - Loading a single LE or CD from a caller-supplied URL
 * - Loading an LE/CD pair concurrently and producing the TRID compliance report
 */
@Slf4j
@Service
public class MortgageToolService {

    static final String DEFAULT_GREETING_NAME = "World";

    private final DocumentLoader documentLoader;
    private final ComplianceComparator complianceComparator;
    private final Executor documentExecutor;

    public MortgageToolService(DocumentLoader documentLoader,
                               ComplianceComparator complianceComparator,
                               @Qualifier("documentExecutor") Executor documentExecutor) {
        this.documentLoader = documentLoader;
        this.complianceComparator = complianceComparator;
        this.documentExecutor = documentExecutor;
    }

    public String hello(String name) {
        return String.format("Hello, %s! MCP server is working correctly.", name == null ? DEFAULT_GREETING_NAME : name);
    }

    public LoanEstimate parseLoanEstimate(String pdfUrl) {
        return documentLoader.loadLoanEstimate(pdfUrl);
    }

    public ClosingDisclosure parseClosingDisclosure(String pdfUrl) {
        return documentLoader.loadClosingDisclosure(pdfUrl);
    }

    /**
     * Loads both disclosures concurrently and compares them.
     * The first failing load aborts the comparison and cancels the other one.
     * A load the executor rejects is reported as a transport failure.
     *
     * @param loanEstimateUrl HTTPS URL of the Loan Estimate PDF
     * @param closingDisclosureUrl HTTPS URL of the Closing Disclosure PDF
     * @return Compliance report
     */
    public ComplianceReport compareLeCd(String loanEstimateUrl, String closingDisclosureUrl) {
        CompletionService<MortgageDisclosure> loads = new ExecutorCompletionService<>(documentExecutor);
        Future<MortgageDisclosure> leLoad = null;
        Future<MortgageDisclosure> cdLoad;
        try {
            leLoad = loads.submit(() -> documentLoader.loadLoanEstimate(loanEstimateUrl));
            cdLoad = loads.submit(() -> documentLoader.loadClosingDisclosure(closingDisclosureUrl));
        } catch (RejectedExecutionException e) {
            if (leLoad != null) {
                leLoad.cancel(true);
            }
            log.warn("Document load rejected, comparison aborted - error: {}", e.getMessage());
            throw new TransportFailureException("Document loading capacity exhausted, try again later", e);
        }

        try {
            for (int completed = 0; completed < 2; completed++) {
                loads.take().get();
            }
            LoanEstimate le = (LoanEstimate) leLoad.get();
            ClosingDisclosure cd = (ClosingDisclosure) cdLoad.get();

            ComplianceReport report = complianceComparator.compare(le, cd);
            log.info("TRID comparison complete - compliant: {}, violations: {}, warnings: {}",
                    report.isCompliant(), report.getViolations().size(), report.getWarnings().size());
            return report;

        } catch (ExecutionException e) {
            leLoad.cancel(true);
            cdLoad.cancel(true);
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            leLoad.cancel(true);
            cdLoad.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportFailureException("Document comparison interrupted", e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof MortgageServerException failure) {
            log.warn("Document load failed, comparison aborted - kind: {}, error: {}", failure.getKind().getCode(), failure.getMessage());
            return failure;
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Document load failed: " + cause.getMessage(), cause);
    }
}
