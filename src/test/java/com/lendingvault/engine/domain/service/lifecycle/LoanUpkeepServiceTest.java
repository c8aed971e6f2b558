package com.lendingvault.engine.domain.service.lifecycle;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.ReceivableAdapter;
import com.lendingvault.engine.domain.gateway.ReceivableAdapters;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.CollateralRef;
import com.lendingvault.engine.domain.model.Loan;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.LoanStatus;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.model.UpkeepTask;
import com.lendingvault.engine.domain.service.ledger.LedgerProperties;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoanUpkeepServiceTest {

    @Mock
    private ReceivableAdapter adapter;

    @Mock
    private LoanLifecycleService lifecycleService;

    private MutableClock clock;
    private TrancheLedger ledger;
    private LoanUpkeepService upkeepService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.bucketAligned();
        ledger = new TrancheLedger(new LedgerProperties(), clock);
        ledger.deposit(TrancheId.SENIOR, "alice", new BigDecimal("100"));

        when(adapter.platform()).thenReturn("demo");
        upkeepService = new LoanUpkeepService(ledger, new ReceivableAdapters(List.of(adapter)), lifecycleService);
    }

    private LoanKey recordLoan(String loanId, Duration untilMaturity) {
        LoanKey key = new LoanKey("demo", loanId);
        ledger.recordPurchase(Loan.builder()
                .key(key)
                .collateral(new CollateralRef("demo-nft", loanId))
                .seller("seller")
                .purchasePrice(new BigDecimal("10"))
                .repayment(new BigDecimal("11"))
                .maturity(clock.epochSecond() + untilMaturity.getSeconds())
                .seniorReturn(new BigDecimal("0.01"))
                .juniorReturn(new BigDecimal("0.99"))
                .adminFee(FixedPoint.ZERO)
                .status(LoanStatus.ACTIVE)
                .build());
        return key;
    }

    @Test
    void nothingToDoWithoutLoans() {
        assertThat(upkeepService.checkUpkeep()).isEmpty();
    }

    @Test
    void loansBeforeTheirBucketAreNotQueried() {
        recordLoan("1", Duration.ofDays(30));

        assertThat(upkeepService.checkUpkeep()).isEmpty();
        verify(adapter, never()).isRepaid(anyString());
    }

    @Test
    void dueRepaidLoanIsReported() {
        LoanKey key = recordLoan("1", Duration.ofDays(30));
        clock.advance(Duration.ofDays(28));
        when(adapter.isRepaid("1")).thenReturn(true);

        assertThat(upkeepService.checkUpkeep()).contains(new UpkeepTask(key, UpkeepTask.Action.REPAID));
    }

    @Test
    void expiredLoanIsReported() {
        LoanKey key = recordLoan("1", Duration.ofDays(30));
        clock.advance(Duration.ofDays(31));
        when(adapter.isRepaid("1")).thenReturn(false);
        when(adapter.isLiquidated("1")).thenReturn(false);
        when(adapter.isExpired("1")).thenReturn(true);

        assertThat(upkeepService.checkUpkeep()).contains(new UpkeepTask(key, UpkeepTask.Action.EXPIRED));
    }

    @Test
    void unavailablePlatformSkipsToNextLoan() {
        recordLoan("a", Duration.ofDays(29));
        LoanKey second = recordLoan("b", Duration.ofDays(30));
        clock.advance(Duration.ofDays(30));
        when(adapter.isRepaid("a")).thenThrow(new VaultException(VaultErrorCode.PLATFORM_UNAVAILABLE, "timeout"));
        when(adapter.isRepaid("b")).thenReturn(true);

        Optional<UpkeepTask> task = upkeepService.checkUpkeep();

        assertThat(task).contains(new UpkeepTask(second, UpkeepTask.Action.REPAID));
    }

    @Test
    void otherErrorsPropagate() {
        recordLoan("a", Duration.ofDays(30));
        clock.advance(Duration.ofDays(30));
        when(adapter.isRepaid("a")).thenThrow(new VaultException(VaultErrorCode.UNSUPPORTED_NOTE_TOKEN, "gone"));

        assertThatThrownBy(() -> upkeepService.checkUpkeep()).isInstanceOf(VaultException.class);
    }

    @Test
    void performDispatchesByAction() {
        LoanKey key = new LoanKey("demo", "1");

        upkeepService.performUpkeep(new UpkeepTask(key, UpkeepTask.Action.LIQUIDATED));
        upkeepService.performUpkeep(new UpkeepTask(key, UpkeepTask.Action.EXPIRED));
        upkeepService.performUpkeep(new UpkeepTask(key, UpkeepTask.Action.REPAID));

        verify(lifecycleService).onLoanLiquidated(key);
        verify(lifecycleService).onLoanExpired(key);
        verify(lifecycleService).onLoanRepaid(key);
    }
}
