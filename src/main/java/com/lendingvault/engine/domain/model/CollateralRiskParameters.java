package com.lendingvault.engine.domain.model;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;

public record CollateralRiskParameters(
        boolean enabled,
        RateModel loanToValueModel,
        RateModel durationModel,
        RateComponentWeights weights
) {
    public CollateralRiskParameters {
        if (loanToValueModel == null || durationModel == null || weights == null) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "collateral risk parameters incomplete");
        }
    }

    public CollateralRiskParameters withEnabled(boolean value) {
        return new CollateralRiskParameters(value, loanToValueModel, durationModel, weights);
    }
}
