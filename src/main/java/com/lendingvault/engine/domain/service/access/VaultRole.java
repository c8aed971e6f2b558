package com.lendingvault.engine.domain.service.access;

public enum VaultRole {
    ADMIN,
    COLLATERAL_LIQUIDATOR
}
