package com.lendingvault.engine.domain.exception;

/**
 * Rejection of a vault operation. Thrown before any ledger mutation, or rolled back by the
 * command dispatcher when raised after one.
 */
public class VaultException extends RuntimeException {

    private final VaultErrorCode errorCode;

    public VaultException(VaultErrorCode errorCode) {
        super(errorCode.description());
        this.errorCode = errorCode;
    }

    public VaultException(VaultErrorCode errorCode, String detail) {
        super(errorCode.description() + ": " + detail);
        this.errorCode = errorCode;
    }

    public VaultException(VaultErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.description() + ": " + detail, cause);
        this.errorCode = errorCode;
    }

    public VaultErrorCode getErrorCode() {
        return errorCode;
    }

    public static void require(boolean condition, VaultErrorCode errorCode) {
        if (!condition) {
            throw new VaultException(errorCode);
        }
    }

    public static void require(boolean condition, VaultErrorCode errorCode, String detail) {
        if (!condition) {
            throw new VaultException(errorCode, detail);
        }
    }
}
