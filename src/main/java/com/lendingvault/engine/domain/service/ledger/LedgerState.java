package com.lendingvault.engine.domain.service.ledger;

import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.Loan;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.TrancheId;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every mutable field of the vault ledger. Copied whole to checkpoint a command.
 */
class LedgerState {

    final EnumMap<TrancheId, Tranche> tranches = new EnumMap<>(TrancheId.class);
    final PendingReturnSchedule pendingReturns;
    final Map<LoanKey, Loan> loans = new LinkedHashMap<>();

    BigDecimal totalCashBalance = FixedPoint.ZERO;
    BigDecimal totalLoanBalance = FixedPoint.ZERO;
    BigDecimal totalReservesBalance = FixedPoint.ZERO;
    BigDecimal totalWithdrawalBalance = FixedPoint.ZERO;
    BigDecimal totalAdminFeeBalance = FixedPoint.ZERO;

    BigDecimal seniorTrancheRate;
    BigDecimal reserveRatio;
    BigDecimal adminFeeRate;
    boolean paused;

    LedgerState() {
        this(new PendingReturnSchedule());
        for (TrancheId id : TrancheId.values()) {
            tranches.put(id, new Tranche(id));
        }
    }

    private LedgerState(PendingReturnSchedule pendingReturns) {
        this.pendingReturns = pendingReturns;
    }

    Tranche tranche(TrancheId id) {
        return tranches.get(id);
    }

    LedgerState copy() {
        LedgerState copy = new LedgerState(pendingReturns.copy());
        tranches.forEach((id, tranche) -> copy.tranches.put(id, tranche.copy()));
        loans.forEach((key, loan) -> copy.loans.put(key, loan.copy()));
        copy.totalCashBalance = totalCashBalance;
        copy.totalLoanBalance = totalLoanBalance;
        copy.totalReservesBalance = totalReservesBalance;
        copy.totalWithdrawalBalance = totalWithdrawalBalance;
        copy.totalAdminFeeBalance = totalAdminFeeBalance;
        copy.seniorTrancheRate = seniorTrancheRate;
        copy.reserveRatio = reserveRatio;
        copy.adminFeeRate = adminFeeRate;
        copy.paused = paused;
        return copy;
    }
}
