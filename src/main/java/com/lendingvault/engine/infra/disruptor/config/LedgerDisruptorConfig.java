package com.lendingvault.engine.infra.disruptor.config;

import com.lendingvault.engine.infra.disruptor.event.LedgerCommandEvent;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommandEventFactory;
import com.lendingvault.engine.infra.disruptor.handler.LedgerCommandHandler;
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
 * Command pipeline: many request threads publish, one consumer thread applies commands to the
 * ledger in sequence order.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LedgerDisruptorConfig {

    private final LedgerCommandHandler ledgerCommandHandler;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;

    private Disruptor<LedgerCommandEvent> commandDisruptor;

    @Bean
    public Disruptor<LedgerCommandEvent> ledgerCommandDisruptor() {
        int bufferSize = DisruptorSupport.requirePowerOfTwo("command", properties.getCommandBufferSize());
        WaitStrategy waitStrategy = DisruptorSupport.waitStrategy(properties.getWaitStrategy());

        commandDisruptor = new Disruptor<>(
                new LedgerCommandEventFactory(),
                bufferSize,
                DisruptorSupport.namedThreadFactory("ledger-command"),
                ProducerType.MULTI,
                waitStrategy
        );

        // a caller blocked on a dropped command gets the failure instead of a timeout
        commandDisruptor.setDefaultExceptionHandler(new PipelineExceptionHandler<LedgerCommandEvent>(
                "command", meterRegistry, (event, ex) -> {
                    if (event.getFuture() != null) {
                        event.getFuture().completeExceptionally(ex);
                    }
                    event.clear();
                }));

        commandDisruptor.handleEventsWith(ledgerCommandHandler);
        commandDisruptor.start();

        log.info("[Disruptor] command pipeline started: Command → Ledger | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());

        return commandDisruptor;
    }

    @Bean
    public RingBuffer<LedgerCommandEvent> ledgerCommandRingBuffer(Disruptor<LedgerCommandEvent> ledgerCommandDisruptor) {
        return ledgerCommandDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (commandDisruptor != null) {
            DisruptorSupport.shutdown(commandDisruptor, "command", properties.getShutdownTimeout());
        }
    }
}
