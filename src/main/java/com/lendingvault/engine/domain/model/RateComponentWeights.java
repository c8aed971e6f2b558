package com.lendingvault.engine.domain.model;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;

/**
 * Integer percent weights of the utilization, loan-to-value and duration rate components.
 */
public record RateComponentWeights(int utilization, int loanToValue, int duration) {

    public static final int TOTAL = 100;

    public RateComponentWeights {
        if (utilization < 0 || loanToValue < 0 || duration < 0
                || utilization + loanToValue + duration != TOTAL) {
            throw new VaultException(VaultErrorCode.INVALID_WEIGHTS,
                    "utilization=" + utilization + ", loanToValue=" + loanToValue + ", duration=" + duration);
        }
    }
}
