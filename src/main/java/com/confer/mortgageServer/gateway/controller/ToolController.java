package com.confer.mortgageServer.gateway.controller;

import com.confer.mortgageServer.gateway.service.ToolGatewayService;
import com.confer.mortgageServer.tool.dto.ToolCallRequest;
import com.confer.mortgageServer.tool.dto.ToolCallResponse;
import com.confer.mortgageServer.tool.model.ToolDefinition;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Tool REST controller - thin HTTP layer over the tool operations.
 *
 * Responsibilities:
 * - Tool discovery
 * - Tool invocation, delegated to ToolGatewayService
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolGatewayService toolGatewayService;

    @GetMapping
    public ResponseEntity<Map<String, List<ToolDefinition>>> listTools() {
        return ResponseEntity.ok(Map.of("tools", toolGatewayService.listTools()));
    }

    /**
     * Invokes a tool.
     *
     * @param request Tool name and its input arguments
     * @return Tool output with the correlation id of the call
     */
    @PostMapping("/call")
    public ResponseEntity<ToolCallResponse> callTool(@Valid @RequestBody ToolCallRequest request) {
        return ResponseEntity.ok(toolGatewayService.callTool(request));
    }
}
