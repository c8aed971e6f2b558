package com.lendingvault.engine.domain.gateway;

import com.lendingvault.engine.domain.model.LoanTerms;

/**
 * Normalised view of one lending platform's loans. Answers are taken as ground truth at call
 * time.
 */
public interface ReceivableAdapter {

    String platform();

    boolean isSupported(String loanId);

    LoanTerms getLoanTerms(String loanId);

    boolean isRepaid(String loanId);

    boolean isLiquidated(String loanId);

    boolean isExpired(String loanId);

    /**
     * Asks the platform to seize the collateral of an expired loan for the note holder.
     */
    void liquidate(String loanId);
}
