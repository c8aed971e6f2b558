package com.lendingvault.engine.infra.disruptor.handler;

import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.model.VaultSnapshot;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommand;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommandEvent;
import com.lendingvault.engine.infra.disruptor.event.LedgerResultEvent;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Sole consumer of the command ring buffer, and therefore the only writer of the ledger.
 * Each command runs atomically; committed commands are forwarded to the output pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerCommandHandler implements EventHandler<LedgerCommandEvent> {

    private final TrancheLedger ledger;
    private final RingBuffer<LedgerResultEvent> ledgerResultRingBuffer;
    private final MeterRegistry meterRegistry;

    private Timer executionTimer;
    private Timer queueLatencyTimer;
    private Counter committedCounter;
    private Counter failedCounter;
    private Counter abandonedCounter;

    @PostConstruct
    void initMetrics() {
        executionTimer = Timer.builder("ledger.commands.execution")
                .description("Ledger command execution time on the consumer thread")
                .register(meterRegistry);
        queueLatencyTimer = Timer.builder("ledger.commands.latency")
                .description("Ledger command latency from submit to completion")
                .register(meterRegistry);
        committedCounter = Counter.builder("ledger.commands.committed")
                .description("Ledger commands committed")
                .register(meterRegistry);
        failedCounter = Counter.builder("ledger.commands.failed")
                .description("Ledger commands rolled back on an unexpected error")
                .register(meterRegistry);
        abandonedCounter = Counter.builder("ledger.commands.abandoned")
                .description("Ledger commands skipped because the caller gave up before they ran")
                .register(meterRegistry);
    }

    @Override
    public void onEvent(LedgerCommandEvent event, long sequence, boolean endOfBatch) {
        LedgerCommand command = event.getCommand();
        CompletableFuture<Object> future = event.getFuture();
        if (command == null || future == null || event.getAction() == null) {
            return;
        }
        if (future.isDone() || !event.claimStart()) {
            abandonedCounter.increment();
            log.warn("[Dispatcher] skipped abandoned command: seq={}, command={}, account={}",
                    sequence, command.type(), command.account());
            event.clear();
            return;
        }

        long startNano = System.nanoTime();
        try {
            Object result = ledger.executeAtomically(event.getAction());
            long elapsed = System.nanoTime() - startNano;

            executionTimer.record(elapsed, TimeUnit.NANOSECONDS);
            queueLatencyTimer.record(System.nanoTime() - event.getSubmitNanoTime(), TimeUnit.NANOSECONDS);
            committedCounter.increment();

            publishResult(command, sequence);
            log.info("[Dispatcher] committed: seq={}, command={}, account={}, loan={}, elapsed={}μs",
                    sequence, command.type(), command.account(), command.loanKey(), elapsed / 1_000);

            future.complete(result);
        } catch (VaultException e) {
            Counter.builder("ledger.commands.rejected")
                    .tag("code", e.getErrorCode().name())
                    .description("Ledger commands rejected by validation")
                    .register(meterRegistry)
                    .increment();
            log.warn("[Dispatcher] rejected: seq={}, command={}, account={}, code={}, reason={}",
                    sequence, command.type(), command.account(), e.getErrorCode(), e.getMessage());
            future.completeExceptionally(e);
        } catch (RuntimeException e) {
            failedCounter.increment();
            log.error("[Dispatcher] failed and rolled back: seq={}, command={}, account={}",
                    sequence, command.type(), command.account(), e);
            future.completeExceptionally(e);
        } finally {
            event.clear();
        }
    }

    private void publishResult(LedgerCommand command, long sequence) {
        VaultSnapshot snapshot = ledger.snapshot();
        long committedAt = System.currentTimeMillis();
        ledgerResultRingBuffer.publishEvent((resultEvent, seq) -> {
            resultEvent.clear();
            resultEvent.setCommand(command);
            resultEvent.setSnapshot(snapshot);
            resultEvent.setCommandSequence(sequence);
            resultEvent.setCommittedAtEpochMs(committedAt);
        });
    }
}
