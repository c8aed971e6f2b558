package com.lendingvault.engine.infra.disruptor.event;

import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.TrancheId;

import java.math.BigDecimal;

/**
 * Descriptive header of a command, carried through the pipeline for logging and the journal.
 */
public record LedgerCommand(
        CommandType type,
        String account,
        TrancheId tranche,
        LoanKey loanKey,
        BigDecimal amount
) {
    public static LedgerCommand depositor(CommandType type, String account, TrancheId tranche, BigDecimal amount) {
        return new LedgerCommand(type, account, tranche, null, amount);
    }

    public static LedgerCommand loan(CommandType type, String account, LoanKey loanKey, BigDecimal amount) {
        return new LedgerCommand(type, account, null, loanKey, amount);
    }

    public static LedgerCommand admin(CommandType type, String account) {
        return new LedgerCommand(type, account, null, null, null);
    }
}
