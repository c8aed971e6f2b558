package com.lendingvault.engine.infra.disruptor.config;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
final class DisruptorSupport {

    private DisruptorSupport() {
    }

    static WaitStrategy waitStrategy(PipelineProperties.WaitStrategyType type) {
        return switch (type) {
            case BLOCKING -> new BlockingWaitStrategy();
            case YIELDING -> new YieldingWaitStrategy();
            case SLEEPING -> new SleepingWaitStrategy();
        };
    }

    static int requirePowerOfTwo(String name, int size) {
        if (size < 1 || Integer.bitCount(size) != 1) {
            throw new IllegalStateException(name + " buffer size must be a power of two: " + size);
        }
        return size;
    }

    static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Drains published events up to {@code timeout}, then halts whatever is left.
     */
    static void shutdown(Disruptor<?> disruptor, String pipeline, Duration timeout) {
        try {
            disruptor.shutdown(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Disruptor] {} pipeline stopped", pipeline);
        } catch (TimeoutException e) {
            log.warn("[Disruptor] {} pipeline did not drain within {}ms, halting", pipeline, timeout.toMillis());
            disruptor.halt();
        }
    }
}
