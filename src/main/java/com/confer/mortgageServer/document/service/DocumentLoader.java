package com.confer.mortgageServer.document.service;

import com.confer.mortgageServer.document.model.ClosingDisclosure;
import com.confer.mortgageServer.document.model.LoanEstimate;
import com.confer.mortgageServer.ingestion.service.DocumentIngestionGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Fetches a disclosure PDF, extracts its fields and materializes the typed document.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentLoader {

    private final DocumentIngestionGateway ingestionGateway;
    private final FieldExtractor fieldExtractor;
    private final DocumentFactory documentFactory;

    public LoanEstimate loadLoanEstimate(String pdfUrl) {
        byte[] pdf = ingestionGateway.fetch(pdfUrl);
        Map<String, Object> fields = fieldExtractor.extractLoanEstimate(pdf);
        LoanEstimate le = documentFactory.loanEstimate(fields);
        log.info("Loan Estimate loaded - fields: {}, totalClosingCosts: {}", fields.size(), le.getTotalClosingCosts());
        return le;
    }

    public ClosingDisclosure loadClosingDisclosure(String pdfUrl) {
        byte[] pdf = ingestionGateway.fetch(pdfUrl);
        Map<String, Object> fields = fieldExtractor.extractClosingDisclosure(pdf);
        ClosingDisclosure cd = documentFactory.closingDisclosure(fields);
        log.info("Closing Disclosure loaded - fields: {}, totalClosingCosts: {}", fields.size(), cd.getTotalClosingCosts());
        return cd;
    }
}
