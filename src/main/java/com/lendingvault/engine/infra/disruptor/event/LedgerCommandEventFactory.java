package com.lendingvault.engine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class LedgerCommandEventFactory implements EventFactory<LedgerCommandEvent> {

    @Override
    public LedgerCommandEvent newInstance() {
        return new LedgerCommandEvent();
    }
}
