package com.confer.mortgageServer.document.model;

import java.math.BigDecimal;

/**
 * Loan terms and itemized cost lines common to both TRID disclosures.
 */
public interface MortgageDisclosure {

    BigDecimal getLoanAmount();

    BigDecimal getInterestRate();

    BigDecimal getApr();

    BigDecimal getMonthlyPayment();

    BigDecimal getOriginationCharges();

    BigDecimal getServicesCannotShop();

    BigDecimal getServicesCanShop();

    BigDecimal getTaxesAndGovFees();

    BigDecimal getPrepaids();

    BigDecimal getInitialEscrow();

    BigDecimal getOtherCosts();

    BigDecimal getTotalClosingCosts();
}
