package com.confer.mortgageServer.catalog.prompt;

/**
 * Prompt for comparing several loan offers side by side.
 */
public class LoanComparisonPrompt {

    private LoanComparisonPrompt() {}

    public static final String PROMPT = """
            Compare these loan options side by side:

            ## Comparison Factors
            1. **Interest Rate & APR**: Which is truly cheaper?
            2. **Closing Costs**: Upfront vs ongoing costs
            3. **Monthly Payment**: Affordability over loan term
            4. **Loan Features**: ARM vs fixed, prepayment penalties, etc.
            5. **Break-even Analysis**: If paying points, when do you break even?
            6. **Total Cost**: What's paid over full loan term?
            7. **Flexibility**: Refinance options, portability

            ## Recommendation
            Based on:
            - Borrower's likely time in home
            - Financial situation
            - Risk tolerance
            - Market conditions

            Which loan is the best choice and why?""";
}
