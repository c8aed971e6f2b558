package com.lendingvault.engine.api.dto;

import java.math.BigDecimal;
import java.util.Map;

public record LoanRequest(
        String platform,
        String loanId,
        BigDecimal minPurchasePrice,
        Map<String, BigDecimal> allocation
) {
}
