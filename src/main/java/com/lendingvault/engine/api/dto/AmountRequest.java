package com.lendingvault.engine.api.dto;

import java.math.BigDecimal;

public record AmountRequest(BigDecimal value, String to) {
}
