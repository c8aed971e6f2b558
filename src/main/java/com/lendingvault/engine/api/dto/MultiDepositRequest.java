package com.lendingvault.engine.api.dto;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Asset amounts keyed by tranche name, deposited together.
 */
public record MultiDepositRequest(Map<String, BigDecimal> amounts) {
}
