package com.lendingvault.engine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "ledger_journal", indexes = {
        @Index(name = "idx_journal_committed_at", columnList = "committedAtEpochMs"),
        @Index(name = "idx_journal_account", columnList = "account")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerJournalEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private long sequence;
    private String command;
    private String account;
    private String tranche;
    private String loanKey;

    @Column(precision = 38, scale = 18)
    private BigDecimal amount;

    @Column(precision = 38, scale = 18)
    private BigDecimal totalCashBalance;

    @Column(precision = 38, scale = 18)
    private BigDecimal totalLoanBalance;

    @Column(precision = 38, scale = 18)
    private BigDecimal totalWithdrawalBalance;

    @Column(precision = 38, scale = 18)
    private BigDecimal totalReservesBalance;

    @Column(precision = 38, scale = 18)
    private BigDecimal totalAdminFeeBalance;

    @Column(precision = 38, scale = 18)
    private BigDecimal seniorDepositValue;

    @Column(precision = 38, scale = 18)
    private BigDecimal seniorRedemptionQueueTotal;

    @Column(precision = 38, scale = 18)
    private BigDecimal seniorRedemptionQueueProcessed;

    @Column(precision = 38, scale = 18)
    private BigDecimal juniorDepositValue;

    @Column(precision = 38, scale = 18)
    private BigDecimal juniorRedemptionQueueTotal;

    @Column(precision = 38, scale = 18)
    private BigDecimal juniorRedemptionQueueProcessed;

    private long committedAtEpochMs;
}
