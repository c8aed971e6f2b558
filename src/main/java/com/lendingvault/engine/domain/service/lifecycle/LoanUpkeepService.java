package com.lendingvault.engine.domain.service.lifecycle;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.ReceivableAdapter;
import com.lendingvault.engine.domain.gateway.ReceivableAdapters;
import com.lendingvault.engine.domain.model.Loan;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.UpkeepTask;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Finds loans due by the current time bucket that the platform reports as resolved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanUpkeepService {

    private final TrancheLedger ledger;
    private final ReceivableAdapters receivableAdapters;
    private final LoanLifecycleService lifecycleService;

    public Optional<UpkeepTask> checkUpkeep() {
        for (Loan loan : ledger.activeLoansDueBy(ledger.now())) {
            LoanKey key = loan.getKey();
            try {
                ReceivableAdapter adapter = receivableAdapters.forPlatform(key.platform());
                if (adapter.isRepaid(key.loanId())) {
                    return Optional.of(new UpkeepTask(key, UpkeepTask.Action.REPAID));
                }
                if (adapter.isLiquidated(key.loanId())) {
                    return Optional.of(new UpkeepTask(key, UpkeepTask.Action.LIQUIDATED));
                }
                if (adapter.isExpired(key.loanId())) {
                    return Optional.of(new UpkeepTask(key, UpkeepTask.Action.EXPIRED));
                }
            } catch (VaultException e) {
                if (e.getErrorCode() != VaultErrorCode.PLATFORM_UNAVAILABLE) {
                    throw e;
                }
                log.warn("[Upkeep] platform unavailable, skipping loan: loan={}, reason={}", key, e.getMessage());
            }
        }
        return Optional.empty();
    }

    public void performUpkeep(UpkeepTask task) {
        switch (task.action()) {
            case REPAID -> lifecycleService.onLoanRepaid(task.loanKey());
            case LIQUIDATED -> lifecycleService.onLoanLiquidated(task.loanKey());
            case EXPIRED -> lifecycleService.onLoanExpired(task.loanKey());
        }
        log.info("[Upkeep] performed: loan={}, action={}", task.loanKey(), task.action());
    }
}
