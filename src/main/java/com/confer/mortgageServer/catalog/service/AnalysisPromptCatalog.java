package com.confer.mortgageServer.catalog.service;

import com.confer.mortgageServer.catalog.exception.CatalogEntryNotFoundException;
import com.confer.mortgageServer.catalog.model.AnalysisType;
import com.confer.mortgageServer.catalog.model.PromptArgument;
import com.confer.mortgageServer.catalog.model.PromptDefinition;
import com.confer.mortgageServer.catalog.model.PromptMessage;
import com.confer.mortgageServer.catalog.model.PromptResult;
import com.confer.mortgageServer.catalog.prompt.LoanComparisonPrompt;
import com.confer.mortgageServer.catalog.prompt.LoanEstimateAnalysisPrompt;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reusable analysis workflows offered to the calling agent.
 */
@Service
public class AnalysisPromptCatalog {

    public static final String ANALYZE_LOAN_ESTIMATE = "analyze_loan_estimate";
    public static final String COMPARE_LOAN_OPTIONS = "compare_loan_options";

    public List<PromptDefinition> listPrompts() {
        return List.of(
                PromptDefinition.builder()
                        .name(ANALYZE_LOAN_ESTIMATE)
                        .description("Structured workflow for analyzing a Loan Estimate")
                        .argument(new PromptArgument("analysis_type",
                                "Type of analysis: quick, comprehensive (default), or compliance", false))
                        .build(),
                PromptDefinition.builder()
                        .name(COMPARE_LOAN_OPTIONS)
                        .description("Guide through comparing multiple loan offers")
                        .build());
    }

    /**
     * Renders a prompt.
     *
     * @param name Prompt name
     * @param analysisType Analysis depth for analyze_loan_estimate (ignored by other prompts, may be null)
     * @return Rendered prompt
     * @throws CatalogEntryNotFoundException if no prompt has that name
     */
    public PromptResult getPrompt(String name, String analysisType) {
        if (ANALYZE_LOAN_ESTIMATE.equals(name)) {
            AnalysisType type = AnalysisType.fromCode(analysisType);
            return PromptResult.builder()
                    .description(LoanEstimateAnalysisPrompt.getDescription(type))
                    .message(PromptMessage.user(LoanEstimateAnalysisPrompt.getPrompt(type)))
                    .build();
        }
        if (COMPARE_LOAN_OPTIONS.equals(name)) {
            return PromptResult.builder()
                    .description("Loan options comparison")
                    .message(PromptMessage.user(LoanComparisonPrompt.PROMPT))
                    .build();
        }
        throw new CatalogEntryNotFoundException("Unknown prompt: " + name);
    }
}
