package com.lendingvault.engine.domain.model;

import java.util.List;

public record VaultSnapshot(
        long timestamp,
        boolean paused,
        BalanceSnapshot balances,
        List<TrancheSnapshot> tranches,
        int activeLoans
) {
}
