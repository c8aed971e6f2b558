package com.lendingvault.engine.domain.model;

import java.math.BigDecimal;
import java.util.Map;

public record PurchaseResult(
        LoanKey loanKey,
        BigDecimal purchasePrice,
        TrancheReturns trancheReturns,
        long maturity,
        Map<TrancheId, BigDecimal> sharesMinted
) {
}
