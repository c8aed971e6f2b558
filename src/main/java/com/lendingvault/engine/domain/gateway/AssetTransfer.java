package com.lendingvault.engine.domain.gateway;

import java.math.BigDecimal;

/**
 * Movement of the deposit asset between an account and the vault. Each call either moves the
 * full amount or throws.
 */
public interface AssetTransfer {

    void pull(String from, BigDecimal amount);

    void push(String to, BigDecimal amount);
}
