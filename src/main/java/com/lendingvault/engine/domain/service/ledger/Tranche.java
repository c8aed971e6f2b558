package com.lendingvault.engine.domain.service.ledger;

import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.TrancheId;

import java.math.BigDecimal;

class Tranche {

    final TrancheId id;
    final ShareRegistry shares;
    final RedemptionQueue redemptions;
    BigDecimal depositValue = FixedPoint.ZERO;

    Tranche(TrancheId id) {
        this(id, new ShareRegistry(), new RedemptionQueue());
    }

    private Tranche(TrancheId id, ShareRegistry shares, RedemptionQueue redemptions) {
        this.id = id;
        this.shares = shares;
        this.redemptions = redemptions;
    }

    /**
     * Realized value still backing outstanding shares.
     */
    BigDecimal realizedValue() {
        return FixedPoint.subOrZero(depositValue, redemptions.pending());
    }

    Tranche copy() {
        Tranche copy = new Tranche(id, shares.copy(), redemptions.copy());
        copy.depositValue = depositValue;
        return copy;
    }
}
