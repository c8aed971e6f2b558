package com.lendingvault.engine.domain.model;

import java.math.BigDecimal;

public record RedemptionSnapshot(
        TrancheId tranche,
        String account,
        BigDecimal pending,
        BigDecimal withdrawn,
        BigDecimal queueTarget,
        BigDecimal available
) {
}
