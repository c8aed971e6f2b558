package com.lendingvault.engine.infra.disruptor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "vault.dispatcher")
public class PipelineProperties {

    /** Must be a power of two. */
    private int commandBufferSize = 1024 * 4;

    /** Must be a power of two. */
    private int outputBufferSize = 1024 * 16;

    private WaitStrategyType waitStrategy = WaitStrategyType.SLEEPING;

    /** How long shutdown waits for in-flight events before halting the pipeline. */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    public enum WaitStrategyType {
        BLOCKING,
        SLEEPING,
        YIELDING
    }
}
