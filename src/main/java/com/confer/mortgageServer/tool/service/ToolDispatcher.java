package com.confer.mortgageServer.tool.service;

import com.confer.mortgageServer.document.exception.DocumentValidationException;
import com.confer.mortgageServer.tool.exception.UnknownOperationException;
import com.confer.mortgageServer.tool.model.ToolCatalog;
import com.confer.mortgageServer.tool.model.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Routes a tool name and its flat argument map to the matching operation.
 * Unknown names are rejected before any operation runs.
 */
@Slf4j
@Service
public class ToolDispatcher {

    private final Map<String, Function<Map<String, Object>, Object>> handlers = new HashMap<>();

    public ToolDispatcher(MortgageToolService toolService) {
        handlers.put(ToolCatalog.HELLO,
                args -> toolService.hello(optionalString(args, "name")));
        handlers.put(ToolCatalog.PARSE_LOAN_ESTIMATE,
                args -> toolService.parseLoanEstimate(requiredString(args, "pdf_url")));
        handlers.put(ToolCatalog.PARSE_CLOSING_DISCLOSURE,
                args -> toolService.parseClosingDisclosure(requiredString(args, "pdf_url")));
        handlers.put(ToolCatalog.COMPARE_LE_CD,
                args -> toolService.compareLeCd(
                        requiredString(args, "loan_estimate_url"),
                        requiredString(args, "closing_disclosure_url")));
    }

    public List<ToolDefinition> listTools() {
        return ToolCatalog.definitions();
    }

    /**
     * Invokes a tool.
     *
     * @param toolName Tool name as advertised by {@link #listTools()}
     * @param arguments Flat argument map (may be null)
     * @return Tool output
     * @throws UnknownOperationException if no handler is registered for the name
     */
    public Object dispatch(String toolName, Map<String, Object> arguments) {
        Function<Map<String, Object>, Object> handler = handlers.get(toolName);
        if (handler == null) {
            log.warn("Unknown tool requested: {}", toolName);
            throw new UnknownOperationException(toolName);
        }
        log.debug("Dispatching tool: {}", toolName);
        return handler.apply(arguments == null ? Map.of() : arguments);
    }

    private static String requiredString(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new DocumentValidationException(name, "is required");
        }
        if (!(value instanceof String text)) {
            throw new DocumentValidationException(name, "must be a string");
        }
        return text;
    }

    private static String optionalString(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value == null ? null : value.toString();
    }
}
