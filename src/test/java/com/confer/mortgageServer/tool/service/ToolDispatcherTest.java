package com.confer.mortgageServer.tool.service;

import com.confer.mortgageServer.document.exception.DocumentValidationException;
import com.confer.mortgageServer.tool.exception.UnknownOperationException;
import com.confer.mortgageServer.tool.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolDispatcherTest {

    @Mock private MortgageToolService toolService;

    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ToolDispatcher(toolService);
    }

    @Test
    @DisplayName("lists the four tools, document tools requiring approval")
    void listsTools() {
        assertThat(dispatcher.listTools())
                .extracting(ToolDefinition::getName)
                .containsExactly("hello", "parse_loan_estimate", "parse_closing_disclosure", "compare_le_cd");
        assertThat(dispatcher.listTools())
                .filteredOn(ToolDefinition::isRequiresApproval)
                .extracting(ToolDefinition::getName)
                .containsExactly("parse_loan_estimate", "parse_closing_disclosure", "compare_le_cd");
    }

    @Test
    @DisplayName("unknown tool is rejected before any operation runs")
    void unknownTool() {
        assertThatThrownBy(() -> dispatcher.dispatch("delete_everything", Map.of("pdf_url", "x")))
                .isInstanceOfSatisfying(UnknownOperationException.class,
                        e -> assertThat(e.getOperation()).isEqualTo("delete_everything"))
                .hasMessage("Unknown tool: delete_everything");
        verifyNoInteractions(toolService);
    }

    @Test
    void helloWithoutArguments() {
        when(toolService.hello(null)).thenReturn("Hello, World! MCP server is working correctly.");

        assertThat(dispatcher.dispatch("hello", null)).isEqualTo("Hello, World! MCP server is working correctly.");
    }

    @Test
    void routesCompareArguments() {
        dispatcher.dispatch("compare_le_cd", Map.of(
                "loan_estimate_url", "https://s3.amazonaws.com/le.pdf",
                "closing_disclosure_url", "https://s3.amazonaws.com/cd.pdf"));

        verify(toolService).compareLeCd("https://s3.amazonaws.com/le.pdf", "https://s3.amazonaws.com/cd.pdf");
    }

    @Test
    @DisplayName("missing required argument is a schema violation naming it")
    void missingArgument() {
        assertThatThrownBy(() -> dispatcher.dispatch("compare_le_cd",
                Map.of("loan_estimate_url", "https://s3.amazonaws.com/le.pdf")))
                .isInstanceOfSatisfying(DocumentValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("closing_disclosure_url"));
        verifyNoInteractions(toolService);
    }

    @Test
    void blankArgument() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("pdf_url", "  ");

        assertThatThrownBy(() -> dispatcher.dispatch("parse_loan_estimate", arguments))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessage("pdf_url: is required");
    }

    @Test
    void nonStringArgument() {
        assertThatThrownBy(() -> dispatcher.dispatch("parse_closing_disclosure", Map.of("pdf_url", 42)))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessage("pdf_url: must be a string");
    }
}
