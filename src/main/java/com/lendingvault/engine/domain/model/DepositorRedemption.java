package com.lendingvault.engine.domain.model;

import com.lendingvault.engine.domain.math.FixedPoint;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * One depositor's outstanding redemption in one tranche. {@code queueTarget} is the tranche's
 * redemption queue total right after this request was queued.
 */
@Getter
@Setter
public class DepositorRedemption {

    private BigDecimal pending = FixedPoint.ZERO;
    private BigDecimal withdrawn = FixedPoint.ZERO;
    private BigDecimal queueTarget = FixedPoint.ZERO;

    public boolean isEmpty() {
        return FixedPoint.isZero(pending);
    }

    /**
     * Amount processed for this depositor and not yet withdrawn.
     */
    public BigDecimal available(BigDecimal processed) {
        if (isEmpty()) {
            return FixedPoint.ZERO;
        }
        BigDecimal queueStart = FixedPoint.sub(queueTarget, pending);
        BigDecimal processedForDepositor = FixedPoint.subOrZero(FixedPoint.min(processed, queueTarget), queueStart);
        return FixedPoint.subOrZero(processedForDepositor, withdrawn);
    }

    public void reset() {
        pending = FixedPoint.ZERO;
        withdrawn = FixedPoint.ZERO;
        queueTarget = FixedPoint.ZERO;
    }

    public DepositorRedemption copy() {
        DepositorRedemption copy = new DepositorRedemption();
        copy.pending = pending;
        copy.withdrawn = withdrawn;
        copy.queueTarget = queueTarget;
        return copy;
    }
}
