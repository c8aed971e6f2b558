package com.lendingvault.engine.domain.model;

import java.math.BigDecimal;

public record TrancheReturns(BigDecimal seniorReturn, BigDecimal juniorReturn, BigDecimal adminFee) {
}
