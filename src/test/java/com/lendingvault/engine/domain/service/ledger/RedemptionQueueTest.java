package com.lendingvault.engine.domain.service.ledger;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.model.RedemptionSnapshot;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.lendingvault.engine.support.VaultAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedemptionQueueTest {

    private RedemptionQueue queue;

    @BeforeEach
    void setUp() {
        queue = new RedemptionQueue();
        queue.enqueue("alice", new BigDecimal("1.5"));
        queue.enqueue("bob", new BigDecimal("1"));
    }

    @Test
    @DisplayName("processing pays the earlier request strictly first")
    void firstInFirstOut() {
        queue.process(new BigDecimal("1"));

        assertThat(queue.available("alice")).isEqualByComparingTo("1");
        assertThat(queue.available("bob")).isEqualByComparingTo("0");

        queue.process(new BigDecimal("1"));

        assertThat(queue.available("alice")).isEqualByComparingTo("1.5");
        assertThat(queue.available("bob")).isEqualByComparingTo("0.5");
        assertThat(queue.pending()).isEqualByComparingTo("0.5");
    }

    @Test
    void withdrawalIsCappedByAvailable() {
        queue.process(new BigDecimal("1"));

        assertRejected(() -> queue.withdraw("alice", new BigDecimal("1.1")), VaultErrorCode.INVALID_AMOUNT);
        assertRejected(() -> queue.withdraw("bob", new BigDecimal("0.1")), VaultErrorCode.INVALID_AMOUNT);

        queue.withdraw("alice", new BigDecimal("0.4"));
        assertThat(queue.available("alice")).isEqualByComparingTo("0.6");
        assertThat(queue.record("alice").getWithdrawn()).isEqualByComparingTo("0.4");
    }

    @Test
    @DisplayName("a fully withdrawn request frees the depositor for a new one")
    void fullyWithdrawnRecordIsCleared() {
        queue.process(new BigDecimal("1.5"));
        queue.withdraw("alice", new BigDecimal("1.5"));

        assertThat(queue.hasOutstanding("alice")).isFalse();
        assertThat(queue.record("alice").isEmpty()).isTrue();

        queue.enqueue("alice", new BigDecimal("2"));
        assertThat(queue.record("alice").getQueueTarget()).isEqualByComparingTo("4.5");
    }

    @Test
    void outstandingRequestBlocksAnother() {
        assertRejected(() -> queue.enqueue("bob", BigDecimal.ONE), VaultErrorCode.REDEMPTION_IN_PROGRESS);
    }

    @Test
    void processingBeyondTotalIsAnError() {
        assertThatThrownBy(() -> queue.process(new BigDecimal("3"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void copyIsIndependent() {
        RedemptionQueue copy = queue.copy();
        copy.process(new BigDecimal("2"));

        assertThat(queue.processed()).isEqualByComparingTo("0");
        assertThat(copy.available("alice")).isEqualByComparingTo("1.5");
    }

    @Nested
    @DisplayName("through the ledger")
    class ThroughLedger {

        private TrancheLedger ledger;

        @BeforeEach
        void setUp() {
            ledger = new TrancheLedger(new LedgerProperties(), MutableClock.bucketAligned());
            ledger.deposit(TrancheId.SENIOR, "alice", new BigDecimal("5"));
            ledger.deposit(TrancheId.SENIOR, "bob", new BigDecimal("5"));
        }

        @Test
        @DisplayName("two depositors redeem, the first queued is paid first")
        void twoDepositorsSameTranche() {
            ledger.redeem(TrancheId.SENIOR, "alice", new BigDecimal("1.5"));
            ledger.redeem(TrancheId.SENIOR, "bob", new BigDecimal("1"));

            assertThat(ledger.redemption(TrancheId.SENIOR, "alice").available()).isEqualByComparingTo("1");
            assertThat(ledger.redemption(TrancheId.SENIOR, "bob").available()).isEqualByComparingTo("0");

            ledger.deposit(TrancheId.SENIOR, "carol", new BigDecimal("2"));

            RedemptionSnapshot alice = ledger.redemption(TrancheId.SENIOR, "alice");
            RedemptionSnapshot bob = ledger.redemption(TrancheId.SENIOR, "bob");
            assertThat(alice.available()).isEqualByComparingTo("1.5");
            assertThat(bob.available()).isEqualByComparingTo("1");
            assertThat(ledger.tranche(TrancheId.SENIOR).depositValue()).isEqualByComparingTo("9.5");
            assertThat(ledger.balances().totalCashBalance()).isEqualByComparingTo("9.5");
            assertThat(ledger.balances().totalReservesBalance()).isEqualByComparingTo("0.95");
        }

        @Test
        void withdrawReducesWithdrawalBalance() {
            ledger.redeem(TrancheId.SENIOR, "alice", new BigDecimal("1.5"));

            assertThat(ledger.withdraw(TrancheId.SENIOR, "alice", new BigDecimal("0.25"))).isEqualByComparingTo("0.25");
            assertThat(ledger.balances().totalWithdrawalBalance()).isEqualByComparingTo("0.75");
            assertThat(ledger.withdrawMaximum(TrancheId.SENIOR, "alice")).isEqualByComparingTo("0.75");
            assertThat(ledger.balances().totalWithdrawalBalance()).isEqualByComparingTo("0");
        }

        @Test
        void withdrawWithNothingAvailableIsRejected() {
            assertRejected(() -> ledger.withdrawMaximum(TrancheId.SENIOR, "bob"), VaultErrorCode.INVALID_AMOUNT);
        }
    }
}
