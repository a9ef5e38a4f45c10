package com.confer.mortgageServer.gateway.service;

import com.confer.mortgageServer.tool.dto.ToolCallRequest;
import com.confer.mortgageServer.tool.dto.ToolCallResponse;
import com.confer.mortgageServer.tool.model.ToolDefinition;
import com.confer.mortgageServer.tool.service.ToolDispatcher;
import com.confer.mortgageServer.util.UrlMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gateway service - runs tool calls arriving over HTTP.
 *
 * Access control (API key, rate limit) has already been applied by the time a call gets here.
 * Responsibilities:
 * - Attach the request correlation id to the response
 * - Log calls with document URLs masked
 * - Forward to the tool dispatcher
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolGatewayService {

    private final CorrelationIdService correlationIdService;
    private final ToolDispatcher toolDispatcher;

    public List<ToolDefinition> listTools() {
        return toolDispatcher.listTools();
    }

    /**
     * Processes a tool call through the gateway.
     *
     * @param request Tool name and flat argument map
     * @return Tool output with the correlation id of the call
     */
    public ToolCallResponse callTool(ToolCallRequest request) {
        String correlationId = correlationIdService.current();
        Map<String, Object> input = request.getInput() == null ? Map.of() : request.getInput();

        log.info("Tool call received - correlationId: {}, tool: {}, arguments: {}",
                correlationId, request.getTool(), describeArguments(input));

        long startedAt = System.currentTimeMillis();
        Object output = toolDispatcher.dispatch(request.getTool(), input);

        log.info("Tool call completed - correlationId: {}, tool: {}, durationMs: {}",
                correlationId, request.getTool(), System.currentTimeMillis() - startedAt);

        return ToolCallResponse.builder()
                .tool(request.getTool())
                .correlationId(correlationId)
                .output(output)
                .build();
    }

    private static String describeArguments(Map<String, Object> input) {
        return input.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + UrlMasker.mask(String.valueOf(entry.getValue())))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
