package com.lendingvault.engine.infra.disruptor.event;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

public class LedgerCommandEvent {

    private LedgerCommand command;
    private Supplier<?> action;
    private CompletableFuture<Object> future;
    private AtomicBoolean started;
    private long submitNanoTime;

    public void clear() {
        command = null;
        action = null;
        future = null;
        started = null;
        submitNanoTime = 0L;
    }

    public LedgerCommand getCommand() {
        return command;
    }

    public void setCommand(LedgerCommand command) {
        this.command = command;
    }

    public Supplier<?> getAction() {
        return action;
    }

    public void setAction(Supplier<?> action) {
        this.action = action;
    }

    public CompletableFuture<Object> getFuture() {
        return future;
    }

    public void setFuture(CompletableFuture<Object> future) {
        this.future = future;
    }

    /**
     * Claimed by whichever side acts first: the consumer running the command or a caller giving up on it.
     */
    public boolean claimStart() {
        return started == null || started.compareAndSet(false, true);
    }

    public void setStarted(AtomicBoolean started) {
        this.started = started;
    }

    public long getSubmitNanoTime() {
        return submitNanoTime;
    }

    public void setSubmitNanoTime(long submitNanoTime) {
        this.submitNanoTime = submitNanoTime;
    }

    @Override
    public String toString() {
        return "LedgerCommandEvent{command=" + command + "}";
    }
}
