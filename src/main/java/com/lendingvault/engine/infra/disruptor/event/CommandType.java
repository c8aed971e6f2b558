package com.lendingvault.engine.infra.disruptor.event;

public enum CommandType {

    DEPOSIT,
    DEPOSIT_MANY,
    REDEEM,
    WITHDRAW,
    WITHDRAW_MAXIMUM,
    PURCHASE,
    PURCHASE_AND_DEPOSIT,
    LOAN_REPAID,
    LOAN_LIQUIDATED,
    LOAN_EXPIRED,
    COLLATERAL_WITHDRAWN,
    COLLATERAL_LIQUIDATED,
    UPKEEP,
    ADMIN_PARAMETERS,
    ADMIN_FEE_WITHDRAWAL;

    public boolean isLoanEvent() {
        return this == PURCHASE || this == PURCHASE_AND_DEPOSIT || this == LOAN_REPAID
                || this == LOAN_LIQUIDATED || this == LOAN_EXPIRED
                || this == COLLATERAL_WITHDRAWN || this == COLLATERAL_LIQUIDATED || this == UPKEEP;
    }

    public boolean isAdministrative() {
        return this == ADMIN_PARAMETERS || this == ADMIN_FEE_WITHDRAWAL;
    }
}
