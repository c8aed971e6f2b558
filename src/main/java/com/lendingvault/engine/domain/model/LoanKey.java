package com.lendingvault.engine.domain.model;

public record LoanKey(String platform, String loanId) {

    @Override
    public String toString() {
        return platform + ":" + loanId;
    }
}
