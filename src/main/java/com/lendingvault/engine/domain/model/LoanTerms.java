package com.lendingvault.engine.domain.model;

import java.math.BigDecimal;

/**
 * Loan data normalised by a platform adapter. Timestamps and durations are epoch seconds.
 */
public record LoanTerms(
        BigDecimal principal,
        BigDecimal repayment,
        long startTime,
        long duration,
        CollateralRef collateral,
        String borrower
) {
    public long maturity() {
        return startTime + duration;
    }
}
