package com.lendingvault.engine.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BiConsumer;

/**
 * Keeps a pipeline alive when a handler throws. The failing event is handed to
 * {@code onFailure} so that a waiting caller can be released.
 */
@Slf4j
public class PipelineExceptionHandler<T> implements ExceptionHandler<T> {

    private final String pipeline;
    private final Counter errorCounter;
    private final BiConsumer<T, Throwable> onFailure;

    public PipelineExceptionHandler(String pipeline, MeterRegistry meterRegistry, BiConsumer<T, Throwable> onFailure) {
        this.pipeline = pipeline;
        this.onFailure = onFailure;
        this.errorCounter = Counter.builder("vault.pipeline.errors")
                .tag("pipeline", pipeline)
                .description("Events dropped after a pipeline handler threw")
                .register(meterRegistry);
    }

    public PipelineExceptionHandler(String pipeline, MeterRegistry meterRegistry) {
        this(pipeline, meterRegistry, (event, ex) -> { });
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, T event) {
        errorCounter.increment();
        log.error("[Disruptor] {} handler failed, event dropped: seq={}, event={}", pipeline, sequence, event, ex);
        if (event != null) {
            onFailure.accept(event, ex);
        }
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Disruptor] {} handler failed to start", pipeline, ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Disruptor] {} handler failed to shut down", pipeline, ex);
    }
}
