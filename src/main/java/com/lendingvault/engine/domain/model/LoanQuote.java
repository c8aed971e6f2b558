package com.lendingvault.engine.domain.model;

import java.math.BigDecimal;

public record LoanQuote(
        BigDecimal purchasePrice,
        BigDecimal discountRate,
        BigDecimal utilization,
        BigDecimal loanToValue,
        BigDecimal utilizationRate,
        BigDecimal loanToValueRate,
        BigDecimal durationRate,
        long durationRemaining
) {
}
