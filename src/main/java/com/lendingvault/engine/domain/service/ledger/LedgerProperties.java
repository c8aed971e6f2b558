package com.lendingvault.engine.domain.service.ledger;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "vault.ledger")
public class LedgerProperties {

    private Duration timeBucketDuration = Duration.ofDays(7);

    private int prorationBuckets = 6;

    /** Annual fraction, normalised to per-second at startup. */
    private BigDecimal seniorTrancheRate = new BigDecimal("0.05");

    private BigDecimal reserveRatio = new BigDecimal("0.10");

    private BigDecimal adminFeeRate = BigDecimal.ZERO;
}
