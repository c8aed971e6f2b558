package com.lendingvault.engine.infra.disruptor.handler;

import com.lendingvault.engine.infra.disruptor.event.LedgerCommandEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineExceptionHandlerTest {

    @Test
    void failedCommandReleasesWaitingCaller() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PipelineExceptionHandler<LedgerCommandEvent> handler = new PipelineExceptionHandler<>("command", registry,
                (event, ex) -> event.getFuture().completeExceptionally(ex));

        LedgerCommandEvent event = new LedgerCommandEvent();
        CompletableFuture<Object> future = new CompletableFuture<>();
        event.setFuture(future);

        handler.handleEventException(new IllegalStateException("boom"), 7L, event);

        assertThat(future).isCompletedExceptionally();
        assertThat(registry.get("vault.pipeline.errors").tag("pipeline", "command").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void nullEventIsOnlyCounted() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PipelineExceptionHandler<LedgerCommandEvent> handler = new PipelineExceptionHandler<>("output", registry);

        handler.handleEventException(new IllegalStateException("boom"), 1L, null);

        assertThat(registry.get("vault.pipeline.errors").tag("pipeline", "output").counter().count())
                .isEqualTo(1.0);
    }
}
