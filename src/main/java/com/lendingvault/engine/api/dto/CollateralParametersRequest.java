package com.lendingvault.engine.api.dto;

import com.lendingvault.engine.domain.model.CollateralRiskParameters;
import com.lendingvault.engine.domain.model.RateComponentWeights;

public record CollateralParametersRequest(
        boolean enabled,
        RateCurveRequest loanToValue,
        RateCurveRequest duration,
        int utilizationWeight,
        int loanToValueWeight,
        int durationWeight
) {
    public CollateralRiskParameters toParameters() {
        return new CollateralRiskParameters(enabled,
                loanToValue == null ? null : loanToValue.toRateModel(),
                duration == null ? null : duration.toRateModel(),
                new RateComponentWeights(utilizationWeight, loanToValueWeight, durationWeight));
    }
}
