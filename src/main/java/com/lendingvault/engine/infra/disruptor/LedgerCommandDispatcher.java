package com.lendingvault.engine.infra.disruptor;

import com.lendingvault.engine.infra.disruptor.event.LedgerCommand;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommandEvent;
import com.lmax.disruptor.RingBuffer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Single serialized entry point for every ledger mutation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerCommandDispatcher {

    private final RingBuffer<LedgerCommandEvent> ledgerCommandRingBuffer;

    @Value("${vault.dispatcher.command-timeout-ms:10000}")
    private long commandTimeoutMs = 10_000L;

    public <T> CompletableFuture<T> submit(LedgerCommand command, Supplier<T> action) {
        return submit(command, action, new AtomicBoolean());
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> submit(LedgerCommand command, Supplier<T> action, AtomicBoolean started) {
        CompletableFuture<Object> future = new CompletableFuture<>();
        ledgerCommandRingBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setCommand(command);
            event.setAction(action);
            event.setFuture(future);
            event.setStarted(started);
            event.setSubmitNanoTime(System.nanoTime());
        });
        return (CompletableFuture<T>) (CompletableFuture<?>) future;
    }

    /**
     * Submits and waits. Rejections are rethrown as the original exception.
     * A command still queued when the timeout expires is abandoned and never applied;
     * one the consumer has already started is waited for until it settles.
     */
    public <T> T execute(LedgerCommand command, Supplier<T> action) {
        AtomicBoolean started = new AtomicBoolean();
        CompletableFuture<T> future = submit(command, action, started);
        try {
            try {
                return future.get(commandTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (started.compareAndSet(false, true)) {
                    future.cancel(false);
                    log.error("[Dispatcher] command abandoned after timeout: command={}, timeout={}ms",
                            command.type(), commandTimeoutMs);
                    throw new IllegalStateException("ledger command timed out: " + command.type(), e);
                }
                log.warn("[Dispatcher] command running past timeout, awaiting outcome: command={}", command.type());
                return future.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("ledger command failed: " + command.type(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for ledger command: " + command.type(), e);
        }
    }

    public void run(LedgerCommand command, Runnable action) {
        execute(command, () -> {
            action.run();
            return Boolean.TRUE;
        });
    }
}
