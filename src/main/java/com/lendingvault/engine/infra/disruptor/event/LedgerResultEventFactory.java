package com.lendingvault.engine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class LedgerResultEventFactory implements EventFactory<LedgerResultEvent> {

    @Override
    public LedgerResultEvent newInstance() {
        return new LedgerResultEvent();
    }
}
