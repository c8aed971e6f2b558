package com.lendingvault.engine.infra.scheduler;

import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.model.UpkeepTask;
import com.lendingvault.engine.infra.disruptor.VaultCommandService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Keeper loop: resolves at most {@code max-tasks-per-run} due loans per tick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "vault.upkeep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LoanUpkeepScheduler {

    private static final int MAX_TASKS_PER_RUN = 16;

    private final VaultCommandService commandService;
    private final MeterRegistry meterRegistry;

    private Counter performedCounter;

    @PostConstruct
    void initMetrics() {
        performedCounter = Counter.builder("vault.upkeep.performed")
                .description("Loan resolutions performed by the keeper loop")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${vault.upkeep.interval-ms:60000}")
    public void runUpkeep() {
        for (int i = 0; i < MAX_TASKS_PER_RUN; i++) {
            Optional<UpkeepTask> task;
            try {
                task = commandService.performUpkeep();
            } catch (VaultException e) {
                log.warn("[Upkeep] task rejected: code={}, reason={}", e.getErrorCode(), e.getMessage());
                return;
            }
            if (task.isEmpty()) {
                return;
            }
            performedCounter.increment();
        }
        log.info("[Upkeep] task limit reached for this run: limit={}", MAX_TASKS_PER_RUN);
    }
}
