package com.confer.mortgageServer.gateway.controller;

import com.confer.mortgageServer.document.exception.DocumentValidationException;
import com.confer.mortgageServer.gateway.service.CorrelationIdService;
import com.confer.mortgageServer.gateway.service.RateLimiter;
import com.confer.mortgageServer.gateway.service.ToolGatewayService;
import com.confer.mortgageServer.ingestion.exception.FormatViolationException;
import com.confer.mortgageServer.ingestion.exception.SecurityViolationException;
import com.confer.mortgageServer.ingestion.exception.TransportFailureException;
import com.confer.mortgageServer.tool.exception.UnknownOperationException;
import com.confer.mortgageServer.tool.model.ToolCatalog;
import com.confer.mortgageServer.tool.service.ToolDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ToolController.class, HealthController.class})
@Import({ToolGatewayService.class, CorrelationIdService.class, RateLimiter.class})
class ToolControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private ToolDispatcher toolDispatcher;

    private static String call(String tool, String input) {
        return "{\"tool\": \"" + tool + "\", \"input\": " + input + "}";
    }

    @Test
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    @DisplayName("lists tool definitions with snake_case fields")
    void listTools() throws Exception {
        when(toolDispatcher.listTools()).thenReturn(ToolCatalog.definitions());

        mockMvc.perform(get("/api/v1/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tools.length()").value(4))
                .andExpect(jsonPath("$.tools[0].name").value("hello"))
                .andExpect(jsonPath("$.tools[0].requires_approval").value(false))
                .andExpect(jsonPath("$.tools[3].name").value("compare_le_cd"))
                .andExpect(jsonPath("$.tools[3].requires_approval").value(true))
                .andExpect(jsonPath("$.tools[3].input_schema.required[1]").value("closing_disclosure_url"));
    }

    @Test
    @DisplayName("successful call returns output and correlation id")
    void callHello() throws Exception {
        when(toolDispatcher.dispatch(eq("hello"), anyMap())).thenReturn("Hello, Ada! MCP server is working correctly.");

        mockMvc.perform(post("/api/v1/tools/call")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(call("hello", "{\"name\": \"Ada\"}")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tool").value("hello"))
                .andExpect(jsonPath("$.correlation_id").isNotEmpty())
                .andExpect(jsonPath("$.output").value("Hello, Ada! MCP server is working correctly."));
    }

    @Nested
    @DisplayName("error envelope")
    class ErrorEnvelope {

        @Test
        void blankToolName() throws Exception {
            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(call("", "{}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("SchemaViolation"))
                    .andExpect(jsonPath("$.field").value("tool"));
            verifyNoInteractions(toolDispatcher);
        }

        @Test
        void malformedJson() throws Exception {
            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("SchemaViolation"));
        }

        @Test
        void unknownTool() throws Exception {
            when(toolDispatcher.dispatch(eq("nope"), any())).thenThrow(new UnknownOperationException("nope"));

            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(call("nope", "{}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("UnknownOperation"))
                    .andExpect(jsonPath("$.message").value("Unknown tool: nope"));
        }

        @Test
        void missingArgument() throws Exception {
            when(toolDispatcher.dispatch(eq("parse_loan_estimate"), any()))
                    .thenThrow(new DocumentValidationException("pdf_url", "is required"));

            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(call("parse_loan_estimate", "{}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("SchemaViolation"))
                    .andExpect(jsonPath("$.field").value("pdf_url"))
                    .andExpect(jsonPath("$.message").value("pdf_url: is required"));
        }

        @Test
        void securityViolationCarriesReason() throws Exception {
            when(toolDispatcher.dispatch(eq("parse_loan_estimate"), any()))
                    .thenThrow(new SecurityViolationException(SecurityViolationException.Reason.DOMAIN_NOT_ALLOWED,
                            "Domain not allowed: evil.com"));

            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(call("parse_loan_estimate", "{\"pdf_url\": \"https://evil.com/a.pdf\"}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("SecurityViolation"))
                    .andExpect(jsonPath("$.reason").value("DOMAIN_NOT_ALLOWED"));
        }

        @Test
        void formatViolation() throws Exception {
            when(toolDispatcher.dispatch(eq("parse_closing_disclosure"), any()))
                    .thenThrow(new FormatViolationException(FormatViolationException.Reason.NOT_A_PDF,
                            "File does not appear to be a valid PDF"));

            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(call("parse_closing_disclosure", "{}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("FormatViolation"))
                    .andExpect(jsonPath("$.reason").value("NOT_A_PDF"));
        }

        @Test
        void transportFailureIsBadGateway() throws Exception {
            when(toolDispatcher.dispatch(eq("compare_le_cd"), any()))
                    .thenThrow(new TransportFailureException("Download timed out after 30000 ms"));

            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(call("compare_le_cd", "{}")))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.kind").value("TransportFailure"));
        }

        @Test
        void unexpectedErrorIsHidden() throws Exception {
            when(toolDispatcher.dispatch(eq("hello"), any())).thenThrow(new IllegalStateException("secret detail"));

            mockMvc.perform(post("/api/v1/tools/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(call("hello", "{}")))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.kind").value("InternalError"))
                    .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
        }
    }

    @Test
    @DisplayName("without a configured key requests need no X-API-Key header")
    void noKeyConfigured() throws Exception {
        when(toolDispatcher.listTools()).thenReturn(ToolCatalog.definitions());

        mockMvc.perform(get("/api/v1/tools"))
                .andExpect(status().isOk());
    }

    @Test
    void inputMayBeOmitted() throws Exception {
        when(toolDispatcher.dispatch(eq("hello"), eq(Map.of()))).thenReturn("Hello, World! MCP server is working correctly.");

        mockMvc.perform(post("/api/v1/tools/call")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool\": \"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("Hello, World! MCP server is working correctly."));
    }
}
