package com.lendingvault.engine.domain.model;

import java.math.BigDecimal;

public record BalanceSnapshot(
        BigDecimal totalCashBalance,
        BigDecimal totalLoanBalance,
        BigDecimal totalReservesBalance,
        BigDecimal totalWithdrawalBalance,
        BigDecimal totalAdminFeeBalance,
        BigDecimal utilization
) {
    /**
     * Cash held for depositors, including cash earmarked for processed redemptions.
     */
    public BigDecimal heldCash() {
        return totalCashBalance.add(totalWithdrawalBalance);
    }
}
