package com.confer.mortgageServer.catalog.prompt;

import com.confer.mortgageServer.catalog.model.AnalysisType;

/**
 * Prompts guiding an agent through a structured review of a parsed Loan Estimate.
 */
public class LoanEstimateAnalysisPrompt {

    private LoanEstimateAnalysisPrompt() {}

    public static final String QUICK = """
            Review this Loan Estimate and provide a brief summary:

            1. Key loan terms (amount, rate, APR, monthly payment)
            2. Total closing costs
            3. Any unusual items that stand out

            Keep response concise (3-4 sentences).""";

    public static final String COMPREHENSIVE = """
            Perform a comprehensive Loan Estimate analysis:

            ## 1. Loan Terms Analysis
            - Loan amount and property value (LTV ratio)
            - Interest rate competitiveness
            - APR vs interest rate (are fees reasonable?)
            - Monthly payment affordability
            - Loan term appropriateness

            ## 2. Closing Costs Breakdown
            Review each section:
            - Origination charges (A): Are points/fees justified?
            - Services borrower cannot shop (B): Reasonable for market?
            - Services borrower can shop (C): Opportunity to save?
            - Taxes and government fees (E): Accurate for jurisdiction?
            - Prepaids (F): Correctly calculated?
            - Initial escrow (G): Sufficient cushion?
            - Other costs (H): Any surprises?

            ## 3. Tolerance Bucket Analysis
            - Identify all zero-tolerance fees
            - Identify 10% tolerance fees
            - Explain what can change before closing

            ## 4. Red Flags & Concerns
            - Unusually high fees
            - Missing disclosures
            - Potential for bait-and-switch
            - APR significantly higher than rate

            ## 5. Borrower Questions
            Suggest 3-5 questions borrower should ask lender

            ## 6. Recommendations
            - Should borrower shop around?
            - Are there opportunities to negotiate?
            - Overall assessment: good/fair/poor deal?

            Format as a detailed report suitable for borrower consultation.""";

    public static final String COMPLIANCE = """
            TRID Compliance Review Checklist:

            ## Required Disclosures
            - [ ] Loan terms clearly stated
            - [ ] Itemization of closing costs
            - [ ] Cash to close calculation
            - [ ] Comparisons section
            - [ ] Other considerations section
            - [ ] Contact information
            - [ ] Loan estimate form used (not old GFE)

            ## Timing Compliance
            - [ ] Provided within 3 business days of application
            - [ ] At least 7 business days before closing
            - [ ] Received by borrower (not just sent)

            ## Accuracy Requirements
            - [ ] APR within 0.125% of final APR (estimate)
            - [ ] Tolerance buckets correctly assigned
            - [ ] All required fees disclosed
            - [ ] No junk fees or padding

            ## Consumer Protections
            - [ ] Loan features clearly explained
            - [ ] Risks disclosed (balloon, prepayment penalty, etc.)
            - [ ] Ability to repay considered
            - [ ] No steering to higher-cost loan

            Provide compliance assessment with any deficiencies noted.""";

    public static String getPrompt(AnalysisType analysisType) {
        switch (analysisType) {
            case QUICK:
                return QUICK;
            case COMPLIANCE:
                return COMPLIANCE;
            default:
                return COMPREHENSIVE;
        }
    }

    public static String getDescription(AnalysisType analysisType) {
        switch (analysisType) {
            case QUICK:
                return "Quick Loan Estimate review";
            case COMPLIANCE:
                return "TRID compliance review of a Loan Estimate";
            default:
                return "Comprehensive Loan Estimate analysis";
        }
    }
}
