package com.lendingvault.engine.domain.model;

import java.math.BigDecimal;

public record TrancheSnapshot(
        TrancheId tranche,
        BigDecimal depositValue,
        BigDecimal pendingRedemptions,
        BigDecimal redemptionQueueTotal,
        BigDecimal redemptionQueueProcessed,
        BigDecimal totalShares,
        BigDecimal estimatedValue,
        BigDecimal sharePrice,
        BigDecimal redemptionSharePrice,
        boolean insolvent
) {
}
