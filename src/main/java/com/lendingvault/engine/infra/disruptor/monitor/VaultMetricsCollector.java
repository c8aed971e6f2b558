package com.lendingvault.engine.infra.disruptor.monitor;

import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommandEvent;
import com.lendingvault.engine.infra.disruptor.event.LedgerResultEvent;
import com.lmax.disruptor.RingBuffer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gauges for pipeline back-pressure and for the vault balances behind it.
 */
@Slf4j
@Component
public class VaultMetricsCollector {

    private final RingBuffer<LedgerCommandEvent> commandRingBuffer;
    private final RingBuffer<LedgerResultEvent> resultRingBuffer;
    private final TrancheLedger ledger;
    private final MeterRegistry meterRegistry;

    public VaultMetricsCollector(
            RingBuffer<LedgerCommandEvent> ledgerCommandRingBuffer,
            RingBuffer<LedgerResultEvent> ledgerResultRingBuffer,
            TrancheLedger ledger,
            MeterRegistry meterRegistry) {
        this.commandRingBuffer = ledgerCommandRingBuffer;
        this.resultRingBuffer = ledgerResultRingBuffer;
        this.ledger = ledger;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        registerRingBuffer("command", commandRingBuffer);
        registerRingBuffer("output", resultRingBuffer);

        Gauge.builder("vault.utilization", ledger, l -> l.utilization().doubleValue())
                .description("Loan balance over cash plus loan balance")
                .register(meterRegistry);
        Gauge.builder("vault.cash.available", ledger, l -> l.availableCash().doubleValue())
                .description("Cash not held back as reserves")
                .register(meterRegistry);
        for (TrancheId tranche : TrancheId.values()) {
            Gauge.builder("vault.tranche.share.price", ledger, l -> l.sharePrice(tranche).doubleValue())
                    .tag("tranche", tranche.name())
                    .description("Share price including accrued pending returns")
                    .register(meterRegistry);
        }
        log.info("[Metrics] pipeline and ledger gauges registered");
    }

    private void registerRingBuffer(String pipeline, RingBuffer<?> ringBuffer) {
        Gauge.builder("disruptor.ringbuffer.utilization", ringBuffer,
                        rb -> 1.0 - ((double) rb.remainingCapacity() / rb.getBufferSize()))
                .tag("pipeline", pipeline)
                .description("Ring buffer utilization (0.0~1.0)")
                .register(meterRegistry);
    }
}
