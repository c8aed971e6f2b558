package com.lendingvault.engine.infra.disruptor.event;

import com.lendingvault.engine.domain.model.VaultSnapshot;

public class LedgerResultEvent {

    private LedgerCommand command;
    private VaultSnapshot snapshot;
    private long commandSequence;
    private long committedAtEpochMs;

    public void clear() {
        command = null;
        snapshot = null;
        commandSequence = 0L;
        committedAtEpochMs = 0L;
    }

    public LedgerCommand getCommand() {
        return command;
    }

    public void setCommand(LedgerCommand command) {
        this.command = command;
    }

    public VaultSnapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(VaultSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public long getCommandSequence() {
        return commandSequence;
    }

    public void setCommandSequence(long commandSequence) {
        this.commandSequence = commandSequence;
    }

    public long getCommittedAtEpochMs() {
        return committedAtEpochMs;
    }

    public void setCommittedAtEpochMs(long committedAtEpochMs) {
        this.committedAtEpochMs = committedAtEpochMs;
    }

    @Override
    public String toString() {
        return "LedgerResultEvent{seq=" + commandSequence + ", command=" + command + "}";
    }
}
