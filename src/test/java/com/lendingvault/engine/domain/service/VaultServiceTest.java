package com.lendingvault.engine.domain.service;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.AssetTransfer;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.service.ledger.LedgerProperties;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Map;

import static com.lendingvault.engine.support.VaultAssertions.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class VaultServiceTest {

    @Mock
    private AssetTransfer assetTransfer;

    private TrancheLedger ledger;
    private VaultService vaultService;

    @BeforeEach
    void setUp() {
        ledger = new TrancheLedger(new LedgerProperties(), MutableClock.bucketAligned());
        vaultService = new VaultService(ledger, assetTransfer);
    }

    @Test
    @DisplayName("the asset pull uses the same truncated amount the ledger books")
    void depositPullsNormalizedAmount() {
        vaultService.deposit("alice", TrancheId.SENIOR, new BigDecimal("10.1234567890123456789"));

        assertThat(ledger.tranche(TrancheId.SENIOR).depositValue()).isEqualByComparingTo("10.123456789012345678");
        verify(assetTransfer).pull("alice", new BigDecimal("10.123456789012345678"));
    }

    @Test
    @DisplayName("an amount below ledger precision is rejected before any transfer")
    void dustDepositIsRejected() {
        assertRejected(() -> vaultService.deposit("alice", TrancheId.SENIOR, new BigDecimal("0.0000000000000000001")),
                VaultErrorCode.INVALID_AMOUNT);

        verifyNoInteractions(assetTransfer);
    }

    @Nested
    @DisplayName("deposit into several tranches")
    class DepositMany {

        @Test
        @DisplayName("books every leg and pulls the total once")
        void depositsIntoBothTranches() {
            Map<TrancheId, BigDecimal> shares = vaultService.depositMany("alice",
                    Map.of(TrancheId.SENIOR, new BigDecimal("10"), TrancheId.JUNIOR, new BigDecimal("5")));

            assertThat(shares.get(TrancheId.SENIOR)).isEqualByComparingTo("10");
            assertThat(shares.get(TrancheId.JUNIOR)).isEqualByComparingTo("5");
            assertThat(ledger.shareBalance(TrancheId.SENIOR, "alice")).isEqualByComparingTo("10");
            assertThat(ledger.shareBalance(TrancheId.JUNIOR, "alice")).isEqualByComparingTo("5");
            assertThat(ledger.balances().totalCashBalance()).isEqualByComparingTo("15");
            verify(assetTransfer).pull("alice", new BigDecimal("15.000000000000000000"));
        }

        @Test
        @DisplayName("one invalid leg rolls back the legs already booked")
        void invalidLegRollsBackAll() {
            assertRejected(() -> ledger.executeAtomically(() -> vaultService.depositMany("alice",
                            Map.of(TrancheId.SENIOR, new BigDecimal("10"), TrancheId.JUNIOR, BigDecimal.ZERO))),
                    VaultErrorCode.INVALID_AMOUNT);

            assertThat(ledger.tranche(TrancheId.SENIOR).depositValue()).isEqualByComparingTo("0");
            assertThat(ledger.shareBalance(TrancheId.SENIOR, "alice")).isEqualByComparingTo("0");
            assertThat(ledger.balances().totalCashBalance()).isEqualByComparingTo("0");
            verifyNoInteractions(assetTransfer);
        }

        @Test
        @DisplayName("a failed pull rolls back every leg")
        void failedPullRollsBackAll() {
            doThrow(new VaultException(VaultErrorCode.INSUFFICIENT_BALANCE, "short"))
                    .when(assetTransfer).pull(anyString(), any());

            assertRejected(() -> ledger.executeAtomically(() -> vaultService.depositMany("alice",
                            Map.of(TrancheId.SENIOR, new BigDecimal("10"), TrancheId.JUNIOR, new BigDecimal("5")))),
                    VaultErrorCode.INSUFFICIENT_BALANCE);

            assertThat(ledger.tranche(TrancheId.SENIOR).depositValue()).isEqualByComparingTo("0");
            assertThat(ledger.tranche(TrancheId.JUNIOR).depositValue()).isEqualByComparingTo("0");
            assertThat(ledger.balances().totalCashBalance()).isEqualByComparingTo("0");
        }

        @Test
        void emptyRequestIsRejected() {
            assertRejected(() -> vaultService.depositMany("alice", Map.of()), VaultErrorCode.INVALID_AMOUNT);
        }
    }
}
