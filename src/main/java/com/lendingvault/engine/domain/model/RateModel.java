package com.lendingvault.engine.domain.model;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.math.FixedPoint;

import java.math.BigDecimal;

/**
 * Piecewise-linear curve from a normalised risk factor to a per-second rate, continuous at
 * {@code kink}.
 */
public record RateModel(
        BigDecimal offset,
        BigDecimal slope1,
        BigDecimal slope2,
        BigDecimal kink,
        BigDecimal max
) {
    public RateModel {
        if (offset == null || slope1 == null || slope2 == null || kink == null || max == null) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "rate model field missing");
        }
        if (offset.signum() < 0 || slope1.signum() < 0 || slope2.signum() < 0
                || kink.signum() < 0 || max.signum() < 0) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "rate model fields must be non-negative");
        }
        if (kink.compareTo(max) > 0) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS,
                    "kink " + kink.toPlainString() + " above max " + max.toPlainString());
        }
        offset = FixedPoint.normalize(offset);
        slope1 = FixedPoint.normalize(slope1);
        slope2 = FixedPoint.normalize(slope2);
        kink = FixedPoint.normalize(kink);
        max = FixedPoint.normalize(max);
    }

    public BigDecimal evaluate(BigDecimal x) {
        if (x.compareTo(max) > 0) {
            throw new VaultException(VaultErrorCode.PARAMETER_OUT_OF_RANGE,
                    "input " + x.toPlainString() + " above max " + max.toPlainString());
        }
        BigDecimal beforeKink = FixedPoint.mul(slope1, FixedPoint.min(x, kink));
        BigDecimal afterKink = FixedPoint.mul(slope2, FixedPoint.subOrZero(x, kink));
        return FixedPoint.add(FixedPoint.add(offset, beforeKink), afterKink);
    }

    /**
     * Builds a model from annual rates at zero, at the kink and at max.
     */
    public static RateModel fromRates(BigDecimal minRate, BigDecimal kinkRate, BigDecimal maxRate,
                                      BigDecimal kink, BigDecimal max) {
        if (minRate == null || kinkRate == null || maxRate == null || kink == null || max == null) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "rate curve field missing");
        }
        if (minRate.compareTo(kinkRate) > 0 || kinkRate.compareTo(maxRate) > 0) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "rates must be non-decreasing");
        }
        if (kink.signum() <= 0 || kink.compareTo(max) > 0) {
            throw new VaultException(VaultErrorCode.INVALID_PARAMETERS, "kink must be in (0, max]");
        }
        BigDecimal rateAtMin = FixedPoint.perSecond(minRate);
        BigDecimal rateAtKink = FixedPoint.perSecond(kinkRate);
        BigDecimal rateAtMax = FixedPoint.perSecond(maxRate);

        BigDecimal slope1 = FixedPoint.div(FixedPoint.sub(rateAtKink, rateAtMin), kink);
        BigDecimal slope2 = max.compareTo(kink) == 0
                ? FixedPoint.ZERO
                : FixedPoint.div(FixedPoint.sub(rateAtMax, rateAtKink), FixedPoint.sub(max, kink));
        return new RateModel(rateAtMin, slope1, slope2, kink, max);
    }
}
