package com.lendingvault.engine.infra.disruptor.handler;

import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.BalanceSnapshot;
import com.lendingvault.engine.domain.model.LedgerJournalEntry;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.model.TrancheSnapshot;
import com.lendingvault.engine.domain.model.VaultSnapshot;
import com.lendingvault.engine.domain.repository.LedgerJournalRepository;
import com.lendingvault.engine.infra.disruptor.event.CommandType;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommand;
import com.lendingvault.engine.infra.disruptor.event.LedgerResultEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerResultHandlersTest {

    private static LedgerResultEvent resultEvent(LedgerCommand command, long sequence) {
        BalanceSnapshot balances = new BalanceSnapshot(new BigDecimal("13"), new BigDecimal("2"), new BigDecimal("1.3"),
                new BigDecimal("0.5"), new BigDecimal("0.02"), new BigDecimal("0.133333333333333333"));
        List<TrancheSnapshot> tranches = List.of(
                new TrancheSnapshot(TrancheId.SENIOR, new BigDecimal("10"), FixedPoint.ZERO, new BigDecimal("0.75"),
                        new BigDecimal("0.25"), new BigDecimal("10"), new BigDecimal("10"), FixedPoint.ONE, FixedPoint.ONE, false),
                new TrancheSnapshot(TrancheId.JUNIOR, new BigDecimal("5"), FixedPoint.ZERO, FixedPoint.ZERO,
                        FixedPoint.ZERO, new BigDecimal("5"), new BigDecimal("5"), FixedPoint.ONE, FixedPoint.ONE, false));
        LedgerResultEvent event = new LedgerResultEvent();
        event.setCommand(command);
        event.setSnapshot(new VaultSnapshot(1_000L, false, balances, tranches, 1));
        event.setCommandSequence(sequence);
        event.setCommittedAtEpochMs(1_000_000L);
        return event;
    }

    @Nested
    @DisplayName("journal")
    class Journal {

        @Mock
        private LedgerJournalRepository journalRepository;

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("entries are saved once per batch")
        void flushesAtEndOfBatch() {
            JournalEventHandler handler = new JournalEventHandler(journalRepository);

            handler.onEvent(resultEvent(LedgerCommand.depositor(CommandType.DEPOSIT, "alice", TrancheId.SENIOR,
                    BigDecimal.TEN), 0L), 0L, false);
            verify(journalRepository, never()).saveAll(anyList());

            handler.onEvent(resultEvent(LedgerCommand.loan(CommandType.PURCHASE, "seller", new LoanKey("demo", "1"),
                    BigDecimal.ONE), 1L), 1L, true);

            ArgumentCaptor<List<LedgerJournalEntry>> captor = ArgumentCaptor.forClass(List.class);
            verify(journalRepository).saveAll(captor.capture());
            List<LedgerJournalEntry> saved = captor.getValue();
            assertThat(saved).hasSize(2);
            assertThat(saved.get(0).getCommand()).isEqualTo("DEPOSIT");
            assertThat(saved.get(0).getTranche()).isEqualTo("SENIOR");
            assertThat(saved.get(1).getLoanKey()).isEqualTo("demo:1");
            assertThat(saved.get(1).getTotalLoanBalance()).isEqualByComparingTo("2");
            assertThat(saved.get(1).getTotalWithdrawalBalance()).isEqualByComparingTo("0.5");
            assertThat(saved.get(1).getTotalReservesBalance()).isEqualByComparingTo("1.3");
            assertThat(saved.get(1).getTotalAdminFeeBalance()).isEqualByComparingTo("0.02");
            assertThat(saved.get(1).getSeniorDepositValue()).isEqualByComparingTo("10");
            assertThat(saved.get(1).getSeniorRedemptionQueueTotal()).isEqualByComparingTo("0.75");
            assertThat(saved.get(1).getSeniorRedemptionQueueProcessed()).isEqualByComparingTo("0.25");
            assertThat(saved.get(1).getJuniorDepositValue()).isEqualByComparingTo("5");
            assertThat(saved.get(1).getJuniorRedemptionQueueTotal()).isEqualByComparingTo("0");
        }

        @Test
        void storageFailureDoesNotStopThePipeline() {
            JournalEventHandler handler = new JournalEventHandler(journalRepository);
            when(journalRepository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("db down"));

            assertThatCode(() -> handler.onEvent(resultEvent(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, "admin"), 0L),
                    0L, true)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("broadcast")
    class Broadcast {

        @Mock
        private SimpMessagingTemplate messagingTemplate;

        @Test
        @DisplayName("loan commands go to the loan topic, the snapshot only at end of batch")
        void sendsSnapshotAtEndOfBatch() {
            LedgerBroadcastHandler handler = new LedgerBroadcastHandler(messagingTemplate);
            LedgerCommand purchase = LedgerCommand.loan(CommandType.PURCHASE, "seller", new LoanKey("demo", "1"), null);

            handler.onEvent(resultEvent(purchase, 0L), 0L, false);
            verify(messagingTemplate).convertAndSend(eq("/topic/loans/demo:1"), any(Object.class));
            verify(messagingTemplate, never()).convertAndSend(eq(LedgerBroadcastHandler.VAULT_TOPIC), any(Object.class));

            handler.onEvent(resultEvent(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, "admin"), 1L), 1L, true);
            verify(messagingTemplate, times(1)).convertAndSend(eq(LedgerBroadcastHandler.VAULT_TOPIC), any(Object.class));
            verify(messagingTemplate, times(1)).convertAndSend(anyString(), any(VaultSnapshot.class));
        }
    }
}
