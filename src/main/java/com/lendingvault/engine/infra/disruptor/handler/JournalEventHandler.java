package com.lendingvault.engine.infra.disruptor.handler;

import com.lendingvault.engine.domain.model.BalanceSnapshot;
import com.lendingvault.engine.domain.model.LedgerJournalEntry;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.model.TrancheSnapshot;
import com.lendingvault.engine.domain.model.VaultSnapshot;
import com.lendingvault.engine.domain.repository.LedgerJournalRepository;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommand;
import com.lendingvault.engine.infra.disruptor.event.LedgerResultEvent;
import com.lmax.disruptor.EventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Persists committed commands in batches, flushed at the end of each Disruptor batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JournalEventHandler implements EventHandler<LedgerResultEvent> {

    private final LedgerJournalRepository journalRepository;

    private final List<LedgerJournalEntry> pendingEntries = new ArrayList<>();

    @Override
    public void onEvent(LedgerResultEvent event, long sequence, boolean endOfBatch) {
        bufferEvent(event);

        if (endOfBatch) {
            flush();
        }
    }

    private void bufferEvent(LedgerResultEvent event) {
        LedgerCommand command = event.getCommand();
        if (command == null || event.getSnapshot() == null) return;

        VaultSnapshot snapshot = event.getSnapshot();
        BalanceSnapshot balances = snapshot.balances();
        LedgerJournalEntry entry = LedgerJournalEntry.builder()
                .sequence(event.getCommandSequence())
                .command(command.type().name())
                .account(command.account())
                .tranche(command.tranche() == null ? null : command.tranche().name())
                .loanKey(command.loanKey() == null ? null : command.loanKey().toString())
                .amount(command.amount())
                .totalCashBalance(balances.totalCashBalance())
                .totalLoanBalance(balances.totalLoanBalance())
                .totalWithdrawalBalance(balances.totalWithdrawalBalance())
                .totalReservesBalance(balances.totalReservesBalance())
                .totalAdminFeeBalance(balances.totalAdminFeeBalance())
                .committedAtEpochMs(event.getCommittedAtEpochMs())
                .build();
        for (TrancheSnapshot tranche : snapshot.tranches()) {
            if (tranche.tranche() == TrancheId.SENIOR) {
                entry.setSeniorDepositValue(tranche.depositValue());
                entry.setSeniorRedemptionQueueTotal(tranche.redemptionQueueTotal());
                entry.setSeniorRedemptionQueueProcessed(tranche.redemptionQueueProcessed());
            } else {
                entry.setJuniorDepositValue(tranche.depositValue());
                entry.setJuniorRedemptionQueueTotal(tranche.redemptionQueueTotal());
                entry.setJuniorRedemptionQueueProcessed(tranche.redemptionQueueProcessed());
            }
        }
        pendingEntries.add(entry);
    }

    private void flush() {
        if (pendingEntries.isEmpty()) return;

        try {
            journalRepository.saveAll(List.copyOf(pendingEntries));
            log.debug("[Journal] batch flushed: entries={}", pendingEntries.size());
        } catch (DataAccessException e) {
            log.error("[Journal] batch flush failed: entries={}", pendingEntries.size(), e);
        } finally {
            pendingEntries.clear();
        }
    }
}
