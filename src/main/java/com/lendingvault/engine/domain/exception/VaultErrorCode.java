package com.lendingvault.engine.domain.exception;

public enum VaultErrorCode {

    PARAMETER_OUT_OF_RANGE(Category.INPUT_VALIDATION, "Parameter out of range"),
    INVALID_PARAMETERS(Category.INPUT_VALIDATION, "Invalid parameters"),
    INVALID_WEIGHTS(Category.INPUT_VALIDATION, "Weights must sum to 100"),
    INVALID_ADDRESS(Category.INPUT_VALIDATION, "Invalid account"),
    INVALID_AMOUNT(Category.INPUT_VALIDATION, "Invalid amount"),
    INVALID_ALLOCATION(Category.INPUT_VALIDATION, "Allocation must sum to 1"),

    INSUFFICIENT_TIME_REMAINING(Category.EXTERNAL_DATA, "Insufficient time remaining"),
    UNSUPPORTED_COLLATERAL(Category.EXTERNAL_DATA, "Unsupported collateral"),
    UNSUPPORTED_NOTE_TOKEN(Category.EXTERNAL_DATA, "Unsupported note token"),
    PRICE_MISMATCH(Category.EXTERNAL_DATA, "Purchase price mismatch"),
    PLATFORM_UNAVAILABLE(Category.EXTERNAL_DATA, "Lending platform unavailable"),

    REPAYMENT_TOO_LOW(Category.ECONOMIC_PRECONDITION, "Repayment too low"),
    INSUFFICIENT_LIQUIDITY(Category.ECONOMIC_PRECONDITION, "Insufficient cash available"),
    SENIOR_RETURN_EXCEEDS_SPREAD(Category.ECONOMIC_PRECONDITION, "Senior return exceeds loan spread"),
    INSUFFICIENT_BALANCE(Category.ECONOMIC_PRECONDITION, "Insufficient balance"),

    UNKNOWN_LOAN(Category.STATE_PRECONDITION, "Unknown loan"),
    LOAN_ALREADY_PURCHASED(Category.STATE_PRECONDITION, "Loan already purchased"),
    LOAN_NOT_REPAID(Category.STATE_PRECONDITION, "Loan not repaid"),
    LOAN_NOT_LIQUIDATED(Category.STATE_PRECONDITION, "Loan not liquidated"),
    LOAN_NOT_EXPIRED(Category.STATE_PRECONDITION, "Loan not expired"),
    COLLATERAL_ALREADY_WITHDRAWN(Category.STATE_PRECONDITION, "Collateral already withdrawn"),
    INSUFFICIENT_SHARES(Category.STATE_PRECONDITION, "Insufficient shares"),
    REDEMPTION_IN_PROGRESS(Category.STATE_PRECONDITION, "Redemption in progress"),
    TRANCHE_INSOLVENT(Category.STATE_PRECONDITION, "Tranche is currently insolvent"),
    PAUSED(Category.STATE_PRECONDITION, "Vault is paused"),

    INVALID_CALLER(Category.ACCESS, "Invalid caller");

    private final Category category;
    private final String description;

    VaultErrorCode(Category category, String description) {
        this.category = category;
        this.description = description;
    }

    public Category category() {
        return category;
    }

    public String description() {
        return description;
    }

    public enum Category {
        INPUT_VALIDATION,
        STATE_PRECONDITION,
        ECONOMIC_PRECONDITION,
        EXTERNAL_DATA,
        ACCESS
    }
}
