package com.lendingvault.engine.api.dto;

import java.math.BigDecimal;

/**
 * Deposit, redemption or withdrawal request. {@code amount} is the asset amount, or the share
 * amount for redemptions; {@code maximum} withdraws everything currently available.
 */
public record DepositorRequest(String tranche, BigDecimal amount, boolean maximum) {
}
