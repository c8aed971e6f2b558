package com.lendingvault.engine.infra.disruptor.config;

import com.lendingvault.engine.infra.disruptor.event.LedgerResultEvent;
import com.lendingvault.engine.infra.disruptor.event.LedgerResultEventFactory;
import com.lendingvault.engine.infra.disruptor.handler.JournalEventHandler;
import com.lendingvault.engine.infra.disruptor.handler.LedgerBroadcastHandler;
import com.lendingvault.engine.infra.disruptor.handler.PipelineExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fan-out of committed commands. Only the command consumer thread publishes here, so the ring
 * is single-producer.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class OutputDisruptorConfig {

    private final LedgerBroadcastHandler ledgerBroadcastHandler;
    private final JournalEventHandler journalEventHandler;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;

    private Disruptor<LedgerResultEvent> outputDisruptor;

    @Bean
    public Disruptor<LedgerResultEvent> ledgerResultDisruptor() {
        int bufferSize = DisruptorSupport.requirePowerOfTwo("output", properties.getOutputBufferSize());
        WaitStrategy waitStrategy = DisruptorSupport.waitStrategy(properties.getWaitStrategy());

        outputDisruptor = new Disruptor<>(
                new LedgerResultEventFactory(),
                bufferSize,
                DisruptorSupport.namedThreadFactory("ledger-output"),
                ProducerType.SINGLE,
                waitStrategy
        );

        outputDisruptor.setDefaultExceptionHandler(new PipelineExceptionHandler<>("output", meterRegistry));
        outputDisruptor.handleEventsWith(ledgerBroadcastHandler, journalEventHandler);
        outputDisruptor.start();

        log.info("[Disruptor] output pipeline started: Result → (STOMP Broadcast || Journal) | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());

        return outputDisruptor;
    }

    @Bean
    public RingBuffer<LedgerResultEvent> ledgerResultRingBuffer(Disruptor<LedgerResultEvent> ledgerResultDisruptor) {
        return ledgerResultDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (outputDisruptor != null) {
            DisruptorSupport.shutdown(outputDisruptor, "output", properties.getShutdownTimeout());
        }
    }
}
