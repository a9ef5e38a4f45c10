package com.confer.mortgageServer.document.service;

import com.confer.mortgageServer.document.model.ClosingDisclosure;
import com.confer.mortgageServer.ingestion.exception.FormatViolationException;
import com.confer.mortgageServer.ingestion.service.DocumentIngestionGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentLoaderTest {

    private static final String CD_URL = "https://mortgage-docs.confer.ai/cd.pdf";
    private static final byte[] PDF = {'%', 'P', 'D', 'F'};

    @Mock private DocumentIngestionGateway ingestionGateway;
    @Mock private FieldExtractor fieldExtractor;
    @Mock private DocumentFactory documentFactory;

    @Test
    void fetchesExtractsAndBuilds() {
        Map<String, Object> fields = Map.of("loan_amount", 300000);
        ClosingDisclosure cd = ClosingDisclosure.builder()
                .loanAmount(new BigDecimal("300000"))
                .interestRate(new BigDecimal("6.5"))
                .apr(new BigDecimal("6.75"))
                .monthlyPayment(new BigDecimal("1896.20"))
                .cashToClose(new BigDecimal("15000"))
                .build();
        when(ingestionGateway.fetch(CD_URL)).thenReturn(PDF);
        when(fieldExtractor.extractClosingDisclosure(PDF)).thenReturn(fields);
        when(documentFactory.closingDisclosure(fields)).thenReturn(cd);

        DocumentLoader loader = new DocumentLoader(ingestionGateway, fieldExtractor, documentFactory);

        assertThat(loader.loadClosingDisclosure(CD_URL)).isSameAs(cd);
    }

    @Test
    void fetchFailureStopsThePipeline() {
        when(ingestionGateway.fetch(CD_URL)).thenThrow(
                new FormatViolationException(FormatViolationException.Reason.NOT_A_PDF, "File does not appear to be a valid PDF"));

        DocumentLoader loader = new DocumentLoader(ingestionGateway, fieldExtractor, documentFactory);

        assertThatThrownBy(() -> loader.loadClosingDisclosure(CD_URL)).isInstanceOf(FormatViolationException.class);
        verifyNoInteractions(fieldExtractor, documentFactory);
    }
}
