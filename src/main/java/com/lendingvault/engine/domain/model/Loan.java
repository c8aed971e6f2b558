package com.lendingvault.engine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * A purchased note. While ACTIVE the tranche returns are the scheduled returns; once
 * LIQUIDATED they hold each tranche's recovery entitlement.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@AllArgsConstructor
public class Loan {

    private LoanKey key;
    private CollateralRef collateral;
    private String seller;
    private BigDecimal purchasePrice;
    private BigDecimal repayment;
    private long maturity;
    private BigDecimal seniorReturn;
    private BigDecimal juniorReturn;
    private BigDecimal adminFee;
    private LoanStatus status;
    private boolean collateralWithdrawn;

    public BigDecimal trancheReturn(TrancheId tranche) {
        return tranche == TrancheId.SENIOR ? seniorReturn : juniorReturn;
    }

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    public boolean isLiquidated() {
        return status == LoanStatus.LIQUIDATED;
    }

    public Loan copy() {
        return toBuilder().build();
    }
}
