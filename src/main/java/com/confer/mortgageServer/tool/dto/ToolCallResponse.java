package com.confer.mortgageServer.tool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a successful tool invocation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToolCallResponse {

    private String tool;

    @JsonProperty("correlation_id")
    private String correlationId;

    /**
     * Greeting text, LoanEstimate, ClosingDisclosure or ComplianceReport depending on the tool.
     */
    private Object output;
}
