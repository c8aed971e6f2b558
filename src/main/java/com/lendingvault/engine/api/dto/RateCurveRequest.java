package com.lendingvault.engine.api.dto;

import com.lendingvault.engine.domain.model.RateModel;

import java.math.BigDecimal;

/**
 * Curve given as annual rates at zero, at the kink and at max.
 */
public record RateCurveRequest(
        BigDecimal minRate,
        BigDecimal kinkRate,
        BigDecimal maxRate,
        BigDecimal kink,
        BigDecimal max
) {
    public RateModel toRateModel() {
        return RateModel.fromRates(minRate, kinkRate, maxRate, kink, max);
    }
}
