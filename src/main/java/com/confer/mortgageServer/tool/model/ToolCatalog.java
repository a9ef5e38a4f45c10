package com.confer.mortgageServer.tool.model;

import java.util.List;
import java.util.Map;

/**
 * Tool definitions exposed for discovery by the calling agent.
 * Defines the structured input schema of each operation.
 */
public class ToolCatalog {

    public static final String HELLO = "hello";
    public static final String PARSE_LOAN_ESTIMATE = "parse_loan_estimate";
    public static final String PARSE_CLOSING_DISCLOSURE = "parse_closing_disclosure";
    public static final String COMPARE_LE_CD = "compare_le_cd";

    private ToolCatalog() {}

    public static List<ToolDefinition> definitions() {
        return List.of(hello(), parseLoanEstimate(), parseClosingDisclosure(), compareLeCd());
    }

    private static ToolDefinition hello() {
        return ToolDefinition.builder()
                .name(HELLO)
                .description("Simple greeting tool for testing MCP connectivity")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "name", Map.of(
                                        "type", "string",
                                        "description", "Name to greet (default: World)"
                                )
                        ),
                        "required", List.of()
                ))
                .requiresApproval(false)
                .build();
    }

    private static ToolDefinition parseLoanEstimate() {
        return ToolDefinition.builder()
                .name(PARSE_LOAN_ESTIMATE)
                .description("""
                        Parse a Loan Estimate PDF into MISMO-compliant structured data.
                        REQUIRES APPROVAL: Downloads external PDF document.
                        Security: Only approved domains allowed, size limit and download timeout enforced.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "pdf_url", Map.of(
                                        "type", "string",
                                        "description", "HTTPS URL to Loan Estimate PDF on an allow-listed domain"
                                )
                        ),
                        "required", List.of("pdf_url")
                ))
                .requiresApproval(true)
                .build();
    }

    private static ToolDefinition parseClosingDisclosure() {
        return ToolDefinition.builder()
                .name(PARSE_CLOSING_DISCLOSURE)
                .description("""
                        Parse a Closing Disclosure PDF into MISMO-compliant structured data.
                        REQUIRES APPROVAL: Downloads external PDF document.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "pdf_url", Map.of(
                                        "type", "string",
                                        "description", "HTTPS URL to Closing Disclosure PDF"
                                )
                        ),
                        "required", List.of("pdf_url")
                ))
                .requiresApproval(true)
                .build();
    }

    private static ToolDefinition compareLeCd() {
        return ToolDefinition.builder()
                .name(COMPARE_LE_CD)
                .description("""
                        Compare Loan Estimate vs Closing Disclosure for TRID compliance.
                        REQUIRES APPROVAL: Downloads and compares two PDF documents.
                        Checks for zero-tolerance, 10% tolerance, and APR violations.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "loan_estimate_url", Map.of(
                                        "type", "string",
                                        "description", "HTTPS URL to Loan Estimate PDF"
                                ),
                                "closing_disclosure_url", Map.of(
                                        "type", "string",
                                        "description", "HTTPS URL to Closing Disclosure PDF"
                                )
                        ),
                        "required", List.of("loan_estimate_url", "closing_disclosure_url")
                ))
                .requiresApproval(true)
                .build();
    }
}
