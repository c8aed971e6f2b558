package com.lendingvault.engine;

import com.lendingvault.engine.domain.gateway.ReceivableAdapter;
import com.lendingvault.engine.domain.gateway.ReceivableAdapters;
import com.lendingvault.engine.domain.model.BalanceSnapshot;
import com.lendingvault.engine.domain.model.CollateralRef;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.LoanTerms;
import com.lendingvault.engine.domain.model.PurchaseResult;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.repository.LedgerJournalRepository;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.infra.custody.HttpCustodyClient;
import com.lendingvault.engine.infra.disruptor.VaultCommandService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = "vault.upkeep.enabled=false")
class LendingVaultApplicationTest {

    private static final long THIRTY_DAYS = 30L * 24 * 3600;

    @Autowired
    private VaultCommandService commandService;

    @Autowired
    private TrancheLedger ledger;

    @Autowired
    private LedgerJournalRepository journalRepository;

    @MockBean
    private HttpCustodyClient custody;

    @MockBean
    private ReceivableAdapters receivableAdapters;

    @Test
    void depositPurchaseAndRepayThroughCommandPipeline() {
        ReceivableAdapter platform = mock(ReceivableAdapter.class);
        LoanKey key = new LoanKey("demo", "1");
        when(receivableAdapters.forPlatform("demo")).thenReturn(platform);
        when(platform.isSupported("1")).thenReturn(true);
        when(platform.getLoanTerms("1")).thenReturn(new LoanTerms(
                new BigDecimal("10"), new BigDecimal("11"), Instant.now().getEpochSecond(), THIRTY_DAYS,
                new CollateralRef("demo-nft", "7"), "borrower"));

        commandService.deposit("alice", TrancheId.SENIOR, new BigDecimal("100"));
        commandService.deposit("bob", TrancheId.JUNIOR, new BigDecimal("100"));
        PurchaseResult purchase = commandService.purchase("seller", key, BigDecimal.ZERO);

        assertThat(purchase.purchasePrice()).isPositive().isLessThan(new BigDecimal("11"));
        assertThat(ledger.loan(key)).isPresent();
        verify(custody).pull("alice", new BigDecimal("100.000000000000000000"));
        verify(custody).receiveNote(key, "seller");
        verify(custody).push("seller", purchase.purchasePrice());

        when(platform.isRepaid("1")).thenReturn(true);
        commandService.onLoanRepaid(key);

        BalanceSnapshot balances = ledger.balances();
        assertThat(ledger.loan(key)).isEmpty();
        assertThat(balances.totalLoanBalance()).isEqualByComparingTo("0");
        assertThat(balances.totalCashBalance())
                .isEqualByComparingTo(new BigDecimal("211").subtract(purchase.purchasePrice()));
        assertThat(ledger.estimatedValue(TrancheId.SENIOR))
                .isEqualByComparingTo(new BigDecimal("100").add(purchase.trancheReturns().seniorReturn()));
        assertThat(ledger.estimatedValue(TrancheId.SENIOR).add(ledger.estimatedValue(TrancheId.JUNIOR)))
                .isEqualByComparingTo(balances.heldCash());

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(journalRepository.count()).isGreaterThanOrEqualTo(4));
    }
}
