package com.lendingvault.engine.domain.model;

public record UpkeepTask(LoanKey loanKey, Action action) {

    public enum Action {
        REPAID,
        LIQUIDATED,
        EXPIRED
    }
}
