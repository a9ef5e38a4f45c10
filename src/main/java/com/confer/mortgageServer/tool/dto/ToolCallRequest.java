package com.confer.mortgageServer.tool.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for a tool invocation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRequest {

    @NotBlank(message = "tool cannot be blank")
    private String tool;

    private Map<String, Object> input = new HashMap<>();
}
