package com.lendingvault.engine.domain.math;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Unsigned 18-decimal fixed point arithmetic on {@link BigDecimal}.
 * <p>
 * Every multiply and divide truncates toward zero at 18 fractional digits so that results
 * are reproducible by any client holding the same inputs. A subtraction that would go
 * below zero is an arithmetic error, never a silent clamp.
 */
public final class FixedPoint {

    public static final int SCALE = 18;
    public static final RoundingMode ROUNDING = RoundingMode.DOWN;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE);

    public static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;

    private FixedPoint() {
    }

    public static BigDecimal of(String value) {
        return normalize(new BigDecimal(value));
    }

    public static BigDecimal of(long value) {
        return normalize(BigDecimal.valueOf(value));
    }

    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("fixed point value must not be null");
        }
        if (value.signum() < 0) {
            throw new ArithmeticException("negative fixed point value: " + value.toPlainString());
        }
        return value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal mul(BigDecimal a, BigDecimal b) {
        return a.multiply(b).setScale(SCALE, ROUNDING);
    }

    public static BigDecimal mul(BigDecimal a, long integer) {
        return a.multiply(BigDecimal.valueOf(integer)).setScale(SCALE, ROUNDING);
    }

    public static BigDecimal div(BigDecimal a, BigDecimal b) {
        if (b.signum() == 0) {
            throw new ArithmeticException("fixed point division by zero");
        }
        return a.divide(b, SCALE, ROUNDING);
    }

    public static BigDecimal div(BigDecimal a, long integer) {
        return div(a, BigDecimal.valueOf(integer));
    }

    /**
     * {@code a * b / c} with a single truncation at the end.
     */
    public static BigDecimal mulDiv(BigDecimal a, BigDecimal b, BigDecimal c) {
        if (c.signum() == 0) {
            throw new ArithmeticException("fixed point division by zero");
        }
        return a.multiply(b).divide(c, SCALE, ROUNDING);
    }

    public static BigDecimal add(BigDecimal a, BigDecimal b) {
        return a.add(b).setScale(SCALE, ROUNDING);
    }

    public static BigDecimal sub(BigDecimal a, BigDecimal b) {
        BigDecimal result = a.subtract(b);
        if (result.signum() < 0) {
            throw new ArithmeticException("fixed point underflow: "
                    + a.toPlainString() + " - " + b.toPlainString());
        }
        return result.setScale(SCALE, ROUNDING);
    }

    /**
     * {@code max(0, a - b)}.
     */
    public static BigDecimal subOrZero(BigDecimal a, BigDecimal b) {
        BigDecimal result = a.subtract(b);
        return result.signum() <= 0 ? ZERO : result.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }

    public static boolean isPositive(BigDecimal value) {
        return value.signum() > 0;
    }

    /**
     * Converts an annual rate fraction into a per-second rate.
     */
    public static BigDecimal perSecond(BigDecimal annualRate) {
        return div(normalize(annualRate), SECONDS_PER_YEAR);
    }
}
