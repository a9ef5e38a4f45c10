package com.confer.mortgageServer.tool.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Discovery metadata for one tool: name, description and JSON schema of its input.
 */
@Value
@Builder
public class ToolDefinition {

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("input_schema")
    Map<String, Object> inputSchema;

    /**
     * Whether the calling agent must obtain explicit user approval before invoking the tool.
     */
    @JsonProperty("requires_approval")
    boolean requiresApproval;
}
