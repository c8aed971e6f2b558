package com.lendingvault.engine.domain.model;

public enum LoanStatus {
    ACTIVE,
    LIQUIDATED
}
