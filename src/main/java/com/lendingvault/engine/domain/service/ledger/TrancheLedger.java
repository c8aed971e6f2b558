package com.lendingvault.engine.domain.service.ledger;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.BalanceSnapshot;
import com.lendingvault.engine.domain.model.DepositorRedemption;
import com.lendingvault.engine.domain.model.Loan;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.LoanStatus;
import com.lendingvault.engine.domain.model.RedemptionSnapshot;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.model.TrancheReturns;
import com.lendingvault.engine.domain.model.TrancheSnapshot;
import com.lendingvault.engine.domain.model.VaultSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Aggregate root of the vault: tranche deposit values and shares, redemption queues,
 * scheduled returns, loans and global balances.
 * <p>
 * Mutations assume the caller holds the write side through {@link #executeAtomically}.
 * Queries take the read side and only ever observe committed state.
 */
@Slf4j
@Component
public class TrancheLedger {

    private final Clock clock;
    private final long bucketWidth;
    private final int prorationBuckets;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private LedgerState state;

    public TrancheLedger(LedgerProperties properties, Clock clock) {
        this.clock = clock;
        this.bucketWidth = properties.getTimeBucketDuration().getSeconds();
        this.prorationBuckets = properties.getProrationBuckets();
        if (bucketWidth <= 0 || prorationBuckets <= 0) {
            throw new IllegalArgumentException("time bucket duration and proration buckets must be positive");
        }

        this.state = new LedgerState();
        state.seniorTrancheRate = validSeniorRate(properties.getSeniorTrancheRate());
        state.reserveRatio = validFraction(properties.getReserveRatio(), "reserveRatio");
        state.adminFeeRate = validFraction(properties.getAdminFeeRate(), "adminFeeRate");

        log.info("[Ledger] initialised: bucket={}s, prorationBuckets={}, seniorRate={}/s, reserveRatio={}, adminFeeRate={}",
                bucketWidth, prorationBuckets, state.seniorTrancheRate.toPlainString(),
                state.reserveRatio.toPlainString(), state.adminFeeRate.toPlainString());
    }

    /**
     * Runs {@code command} under the write lock. Any exception restores the state held
     * before the command started.
     */
    public <T> T executeAtomically(Supplier<T> command) {
        lock.writeLock().lock();
        LedgerState checkpoint = state.copy();
        try {
            return command.get();
        } catch (RuntimeException e) {
            state = checkpoint;
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long now() {
        return clock.instant().getEpochSecond();
    }

    public long bucketOf(long timestamp) {
        return Math.floorDiv(timestamp, bucketWidth);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public BigDecimal estimatedValue(TrancheId id) {
        return read(() -> estimatedValue(state.tranche(id), now()));
    }

    public BigDecimal sharePrice(TrancheId id) {
        return read(() -> sharePrice(state.tranche(id), now()));
    }

    public BigDecimal redemptionSharePrice(TrancheId id) {
        return read(() -> redemptionSharePrice(state.tranche(id)));
    }

    public BigDecimal shareBalance(TrancheId id, String account) {
        return read(() -> state.tranche(id).shares.balanceOf(account));
    }

    public BigDecimal utilization() {
        return read(this::currentUtilization);
    }

    public BigDecimal availableCash() {
        return read(() -> FixedPoint.subOrZero(state.totalCashBalance, state.totalReservesBalance));
    }

    public boolean isPaused() {
        return read(() -> state.paused);
    }

    public BigDecimal seniorTrancheRate() {
        return read(() -> state.seniorTrancheRate);
    }

    public BigDecimal reserveRatio() {
        return read(() -> state.reserveRatio);
    }

    public BigDecimal adminFeeRate() {
        return read(() -> state.adminFeeRate);
    }

    public BigDecimal pendingReturns(long bucket, TrancheId id) {
        return read(() -> state.pendingReturns.pending(bucket, id));
    }

    public TrancheSnapshot tranche(TrancheId id) {
        return read(() -> snapshotOf(state.tranche(id), now()));
    }

    public BalanceSnapshot balances() {
        return read(() -> new BalanceSnapshot(
                state.totalCashBalance,
                state.totalLoanBalance,
                state.totalReservesBalance,
                state.totalWithdrawalBalance,
                state.totalAdminFeeBalance,
                currentUtilization()));
    }

    public RedemptionSnapshot redemption(TrancheId id, String account) {
        return read(() -> {
            RedemptionQueue queue = state.tranche(id).redemptions;
            DepositorRedemption record = queue.record(account);
            return new RedemptionSnapshot(id, account, record.getPending(), record.getWithdrawn(),
                    record.getQueueTarget(), queue.available(account));
        });
    }

    public Optional<Loan> loan(LoanKey key) {
        return read(() -> Optional.ofNullable(state.loans.get(key)).map(Loan::copy));
    }

    /**
     * Active loans whose maturity bucket is the current bucket or earlier, earliest first.
     */
    public List<Loan> activeLoansDueBy(long timestamp) {
        long bucket = bucketOf(timestamp);
        return read(() -> state.loans.values().stream()
                .filter(Loan::isActive)
                .filter(loan -> bucketOf(loan.getMaturity()) <= bucket)
                .sorted(Comparator.comparingLong(Loan::getMaturity))
                .map(Loan::copy)
                .toList());
    }

    public VaultSnapshot snapshot() {
        return read(() -> {
            long now = now();
            List<TrancheSnapshot> tranches = Arrays.stream(TrancheId.values())
                    .map(id -> snapshotOf(state.tranche(id), now))
                    .toList();
            int activeLoans = (int) state.loans.values().stream().filter(Loan::isActive).count();
            return new VaultSnapshot(now, state.paused, balances(), tranches, activeLoans);
        });
    }

    // ---------------------------------------------------------------------
    // Deposits and redemptions
    // ---------------------------------------------------------------------

    /**
     * @return shares minted
     */
    public BigDecimal deposit(TrancheId id, String account, BigDecimal rawAmount) {
        requireAccount(account);
        requireNotPaused();
        BigDecimal amount = positiveAmount(rawAmount);
        Tranche tranche = state.tranche(id);
        VaultException.require(!isInsolvent(tranche), VaultErrorCode.TRANCHE_INSOLVENT, id.name());

        BigDecimal price = sharePrice(tranche, now());
        BigDecimal shares = FixedPoint.div(amount, price);

        tranche.shares.mint(account, shares);
        tranche.depositValue = FixedPoint.add(tranche.depositValue, amount);
        processInflow(amount);

        log.info("[Ledger] deposit: tranche={}, account={}, amount={}, shares={}, sharePrice={}",
                id, account, amount.toPlainString(), shares.toPlainString(), price.toPlainString());
        return shares;
    }

    /**
     * Queues a redemption priced at the realized share price.
     *
     * @return amount owed to the depositor
     */
    public BigDecimal redeem(TrancheId id, String account, BigDecimal rawShares) {
        requireAccount(account);
        requireNotPaused();
        BigDecimal shares = positiveAmount(rawShares);
        Tranche tranche = state.tranche(id);
        VaultException.require(!isInsolvent(tranche), VaultErrorCode.TRANCHE_INSOLVENT, id.name());
        VaultException.require(tranche.shares.balanceOf(account).compareTo(shares) >= 0,
                VaultErrorCode.INSUFFICIENT_SHARES, "account=" + account);
        VaultException.require(!tranche.redemptions.hasOutstanding(account),
                VaultErrorCode.REDEMPTION_IN_PROGRESS, "account=" + account);

        BigDecimal amount = FixedPoint.mul(shares, redemptionSharePrice(tranche));
        requirePositive(amount);

        tranche.shares.burn(account, shares);
        tranche.redemptions.enqueue(account, amount);
        BigDecimal drained = drainFromReserves();

        log.info("[Ledger] redeem: tranche={}, account={}, shares={}, amount={}, drainedFromReserves={}",
                id, account, shares.toPlainString(), amount.toPlainString(), drained.toPlainString());
        return amount;
    }

    public BigDecimal withdraw(TrancheId id, String account, BigDecimal rawAmount) {
        requireAccount(account);
        requireNotPaused();
        BigDecimal amount = positiveAmount(rawAmount);
        Tranche tranche = state.tranche(id);

        tranche.redemptions.withdraw(account, amount);
        state.totalWithdrawalBalance = FixedPoint.sub(state.totalWithdrawalBalance, amount);

        log.info("[Ledger] withdraw: tranche={}, account={}, amount={}", id, account, amount.toPlainString());
        return amount;
    }

    public BigDecimal withdrawMaximum(TrancheId id, String account) {
        requireAccount(account);
        BigDecimal available = state.tranche(id).redemptions.available(account);
        return withdraw(id, account, available);
    }

    // ---------------------------------------------------------------------
    // Loans
    // ---------------------------------------------------------------------

    /**
     * Splits the spread of a candidate loan between the tranches. Pure.
     */
    public TrancheReturns computeTrancheReturns(BigDecimal purchasePrice, BigDecimal repayment, long duration) {
        VaultException.require(repayment.compareTo(purchasePrice) > 0, VaultErrorCode.REPAYMENT_TOO_LOW);
        BigDecimal spread = FixedPoint.sub(repayment, purchasePrice);

        Tranche senior = state.tranche(TrancheId.SENIOR);
        Tranche junior = state.tranche(TrancheId.JUNIOR);
        BigDecimal totalDeposits = FixedPoint.add(senior.depositValue, junior.depositValue);

        BigDecimal seniorReturn = FixedPoint.ZERO;
        if (FixedPoint.isPositive(totalDeposits)) {
            BigDecimal fullSeniorReturn = FixedPoint.mul(
                    FixedPoint.mul(purchasePrice, state.seniorTrancheRate), Math.max(duration, 0L));
            seniorReturn = FixedPoint.mulDiv(fullSeniorReturn, senior.depositValue, totalDeposits);
        }
        BigDecimal adminFee = FixedPoint.mul(state.adminFeeRate, spread);

        VaultException.require(FixedPoint.add(seniorReturn, adminFee).compareTo(spread) < 0,
                VaultErrorCode.SENIOR_RETURN_EXCEEDS_SPREAD,
                "seniorReturn=" + seniorReturn.toPlainString() + ", spread=" + spread.toPlainString());

        BigDecimal juniorReturn = FixedPoint.sub(FixedPoint.sub(spread, seniorReturn), adminFee);
        return new TrancheReturns(seniorReturn, juniorReturn, adminFee);
    }

    public void recordPurchase(Loan loan) {
        VaultException.require(!state.loans.containsKey(loan.getKey()),
                VaultErrorCode.LOAN_ALREADY_PURCHASED, loan.getKey().toString());
        BigDecimal available = FixedPoint.subOrZero(state.totalCashBalance, state.totalReservesBalance);
        VaultException.require(loan.getPurchasePrice().compareTo(available) <= 0,
                VaultErrorCode.INSUFFICIENT_LIQUIDITY,
                "price=" + loan.getPurchasePrice().toPlainString() + ", available=" + available.toPlainString());

        Loan stored = loan.copy();
        stored.setStatus(LoanStatus.ACTIVE);

        state.totalCashBalance = FixedPoint.sub(state.totalCashBalance, stored.getPurchasePrice());
        state.totalLoanBalance = FixedPoint.add(state.totalLoanBalance, stored.getPurchasePrice());
        long bucket = bucketOf(stored.getMaturity());
        state.pendingReturns.schedule(bucket, TrancheId.SENIOR, stored.getSeniorReturn());
        state.pendingReturns.schedule(bucket, TrancheId.JUNIOR, stored.getJuniorReturn());
        state.loans.put(stored.getKey(), stored);

        log.info("[Ledger] purchase recorded: loan={}, price={}, repayment={}, seniorReturn={}, juniorReturn={}, bucket={}",
                stored.getKey(), stored.getPurchasePrice().toPlainString(), stored.getRepayment().toPlainString(),
                stored.getSeniorReturn().toPlainString(), stored.getJuniorReturn().toPlainString(), bucket);
    }

    public void realizeRepayment(LoanKey key) {
        Loan loan = requireActiveLoan(key);

        unscheduleReturns(loan);
        Tranche senior = state.tranche(TrancheId.SENIOR);
        Tranche junior = state.tranche(TrancheId.JUNIOR);
        senior.depositValue = FixedPoint.add(senior.depositValue, loan.getSeniorReturn());
        junior.depositValue = FixedPoint.add(junior.depositValue, loan.getJuniorReturn());
        state.totalLoanBalance = FixedPoint.sub(state.totalLoanBalance, loan.getPurchasePrice());
        state.totalAdminFeeBalance = FixedPoint.add(state.totalAdminFeeBalance, loan.getAdminFee());
        processInflow(FixedPoint.sub(loan.getRepayment(), loan.getAdminFee()));
        state.loans.remove(key);

        log.info("[Ledger] repayment realized: loan={}, seniorReturn={}, juniorReturn={}, adminFee={}",
                key, loan.getSeniorReturn().toPlainString(), loan.getJuniorReturn().toPlainString(),
                loan.getAdminFee().toPlainString());
    }

    /**
     * Writes the loan off, junior first, and turns its tranche returns into recovery
     * entitlements.
     */
    public void applyDefault(LoanKey key) {
        Loan loan = requireActiveLoan(key);
        Tranche senior = state.tranche(TrancheId.SENIOR);
        Tranche junior = state.tranche(TrancheId.JUNIOR);

        BigDecimal juniorLoss = FixedPoint.min(loan.getPurchasePrice(), junior.depositValue);
        BigDecimal seniorLoss = FixedPoint.sub(loan.getPurchasePrice(), juniorLoss);

        unscheduleReturns(loan);
        junior.depositValue = FixedPoint.sub(junior.depositValue, juniorLoss);
        senior.depositValue = FixedPoint.sub(senior.depositValue, seniorLoss);
        state.totalLoanBalance = FixedPoint.sub(state.totalLoanBalance, loan.getPurchasePrice());

        loan.setSeniorReturn(FixedPoint.add(seniorLoss, loan.getSeniorReturn()));
        loan.setJuniorReturn(FixedPoint.add(juniorLoss, loan.getJuniorReturn()));
        loan.setStatus(LoanStatus.LIQUIDATED);

        log.warn("[Ledger] loan defaulted: loan={}, seniorLoss={}, juniorLoss={}",
                key, seniorLoss.toPlainString(), juniorLoss.toPlainString());
    }

    /**
     * Distributes collateral liquidation proceeds, senior first, and resolves the loan.
     */
    public void applyRecovery(LoanKey key, BigDecimal proceeds) {
        Loan loan = requireLiquidatedLoan(key);

        BigDecimal seniorRecovery = FixedPoint.min(proceeds, loan.getSeniorReturn());
        BigDecimal juniorRecovery = FixedPoint.sub(proceeds, seniorRecovery);

        Tranche senior = state.tranche(TrancheId.SENIOR);
        Tranche junior = state.tranche(TrancheId.JUNIOR);
        senior.depositValue = FixedPoint.add(senior.depositValue, seniorRecovery);
        junior.depositValue = FixedPoint.add(junior.depositValue, juniorRecovery);
        processInflow(proceeds);
        state.loans.remove(key);

        log.info("[Ledger] collateral proceeds distributed: loan={}, proceeds={}, seniorRecovery={}, juniorRecovery={}",
                key, proceeds.toPlainString(), seniorRecovery.toPlainString(), juniorRecovery.toPlainString());
    }

    public void markCollateralWithdrawn(LoanKey key) {
        Loan loan = requireLiquidatedLoan(key);
        VaultException.require(!loan.isCollateralWithdrawn(),
                VaultErrorCode.COLLATERAL_ALREADY_WITHDRAWN, key.toString());
        loan.setCollateralWithdrawn(true);
    }

    // ---------------------------------------------------------------------
    // Administration
    // ---------------------------------------------------------------------

    public void setSeniorTrancheRate(BigDecimal annualRate) {
        state.seniorTrancheRate = validSeniorRate(annualRate);
        log.info("[Ledger] senior tranche rate set: annual={}, perSecond={}",
                annualRate.toPlainString(), state.seniorTrancheRate.toPlainString());
    }

    public void setReserveRatio(BigDecimal ratio) {
        state.reserveRatio = validFraction(ratio, "reserveRatio");
        state.totalReservesBalance = FixedPoint.mul(state.totalCashBalance, state.reserveRatio);
        log.info("[Ledger] reserve ratio set: ratio={}, reserves={}",
                state.reserveRatio.toPlainString(), state.totalReservesBalance.toPlainString());
    }

    public void setAdminFeeRate(BigDecimal rate) {
        state.adminFeeRate = validFraction(rate, "adminFeeRate");
        log.info("[Ledger] admin fee rate set: rate={}", state.adminFeeRate.toPlainString());
    }

    public void setPaused(boolean paused) {
        state.paused = paused;
        log.info("[Ledger] paused={}", paused);
    }

    public BigDecimal withdrawAdminFees(BigDecimal rawAmount) {
        BigDecimal amount = positiveAmount(rawAmount);
        VaultException.require(amount.compareTo(state.totalAdminFeeBalance) <= 0,
                VaultErrorCode.INSUFFICIENT_BALANCE, "adminFeeBalance=" + state.totalAdminFeeBalance.toPlainString());
        state.totalAdminFeeBalance = FixedPoint.sub(state.totalAdminFeeBalance, amount);
        log.info("[Ledger] admin fees withdrawn: amount={}", amount.toPlainString());
        return amount;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private BigDecimal estimatedValue(Tranche tranche, long now) {
        BigDecimal prorated = state.pendingReturns.prorated(tranche.id, now, bucketWidth, prorationBuckets);
        return FixedPoint.add(tranche.realizedValue(), prorated);
    }

    private BigDecimal sharePrice(Tranche tranche, long now) {
        BigDecimal totalShares = tranche.shares.totalSupply();
        if (FixedPoint.isZero(totalShares)) {
            return FixedPoint.ONE;
        }
        return FixedPoint.div(estimatedValue(tranche, now), totalShares);
    }

    private BigDecimal redemptionSharePrice(Tranche tranche) {
        BigDecimal totalShares = tranche.shares.totalSupply();
        if (FixedPoint.isZero(totalShares)) {
            return FixedPoint.ONE;
        }
        return FixedPoint.div(tranche.realizedValue(), totalShares);
    }

    private boolean isInsolvent(Tranche tranche) {
        return FixedPoint.isPositive(tranche.shares.totalSupply())
                && FixedPoint.isZero(redemptionSharePrice(tranche));
    }

    private TrancheSnapshot snapshotOf(Tranche tranche, long now) {
        return new TrancheSnapshot(
                tranche.id,
                tranche.depositValue,
                tranche.redemptions.pending(),
                tranche.redemptions.total(),
                tranche.redemptions.processed(),
                tranche.shares.totalSupply(),
                estimatedValue(tranche, now),
                sharePrice(tranche, now),
                redemptionSharePrice(tranche),
                isInsolvent(tranche));
    }

    private BigDecimal currentUtilization() {
        BigDecimal total = FixedPoint.add(state.totalCashBalance, state.totalLoanBalance);
        if (FixedPoint.isZero(total)) {
            return FixedPoint.ZERO;
        }
        return FixedPoint.div(state.totalLoanBalance, total);
    }

    /**
     * Drains redemption queues from a cash inflow, then books the rest as cash.
     */
    private void processInflow(BigDecimal inflow) {
        BigDecimal drained = drainQueues(inflow);
        state.totalCashBalance = FixedPoint.add(state.totalCashBalance, FixedPoint.sub(inflow, drained));
        state.totalReservesBalance = FixedPoint.mul(state.totalCashBalance, state.reserveRatio);
    }

    private BigDecimal drainFromReserves() {
        BigDecimal drained = drainQueues(state.totalReservesBalance);
        state.totalReservesBalance = FixedPoint.sub(state.totalReservesBalance, drained);
        state.totalCashBalance = FixedPoint.sub(state.totalCashBalance, drained);
        return drained;
    }

    /**
     * Senior queue first, then junior. A tranche never pays out more than its deposit value.
     */
    private BigDecimal drainQueues(BigDecimal available) {
        BigDecimal remaining = available;
        for (TrancheId id : TrancheId.values()) {
            Tranche tranche = state.tranche(id);
            BigDecimal drained = FixedPoint.min(FixedPoint.min(tranche.redemptions.pending(), remaining),
                    tranche.depositValue);
            if (!FixedPoint.isPositive(drained)) {
                continue;
            }
            tranche.redemptions.process(drained);
            tranche.depositValue = FixedPoint.sub(tranche.depositValue, drained);
            state.totalWithdrawalBalance = FixedPoint.add(state.totalWithdrawalBalance, drained);
            remaining = FixedPoint.sub(remaining, drained);

            log.debug("[Ledger] redemption queue drained: tranche={}, amount={}, processed={}",
                    id, drained.toPlainString(), tranche.redemptions.processed().toPlainString());
        }
        return FixedPoint.sub(available, remaining);
    }

    private void unscheduleReturns(Loan loan) {
        long bucket = bucketOf(loan.getMaturity());
        state.pendingReturns.unschedule(bucket, TrancheId.SENIOR, loan.getSeniorReturn());
        state.pendingReturns.unschedule(bucket, TrancheId.JUNIOR, loan.getJuniorReturn());
    }

    private Loan requireActiveLoan(LoanKey key) {
        Loan loan = state.loans.get(key);
        if (loan == null || !loan.isActive()) {
            throw new VaultException(VaultErrorCode.UNKNOWN_LOAN, String.valueOf(key));
        }
        return loan;
    }

    private Loan requireLiquidatedLoan(LoanKey key) {
        Loan loan = state.loans.get(key);
        if (loan == null) {
            throw new VaultException(VaultErrorCode.UNKNOWN_LOAN, String.valueOf(key));
        }
        VaultException.require(loan.isLiquidated(), VaultErrorCode.LOAN_NOT_LIQUIDATED, key.toString());
        return loan;
    }

    private void requireNotPaused() {
        VaultException.require(!state.paused, VaultErrorCode.PAUSED);
    }

    private static void requireAccount(String account) {
        VaultException.require(account != null && !account.isBlank(), VaultErrorCode.INVALID_ADDRESS);
    }

    private static void requirePositive(BigDecimal amount) {
        VaultException.require(amount != null && amount.signum() > 0, VaultErrorCode.INVALID_AMOUNT);
    }

    /**
     * Validates a caller-supplied amount and truncates it to ledger precision.
     * Amounts that truncate to zero are rejected.
     */
    public static BigDecimal positiveAmount(BigDecimal amount) {
        requirePositive(amount);
        BigDecimal normalized = FixedPoint.normalize(amount);
        VaultException.require(normalized.signum() > 0, VaultErrorCode.INVALID_AMOUNT);
        return normalized;
    }

    private static BigDecimal validSeniorRate(BigDecimal annualRate) {
        VaultException.require(annualRate != null && annualRate.signum() > 0 && annualRate.compareTo(BigDecimal.ONE) < 0,
                VaultErrorCode.PARAMETER_OUT_OF_RANGE, "seniorTrancheRate must be in (0, 1)");
        return FixedPoint.perSecond(annualRate);
    }

    private static BigDecimal validFraction(BigDecimal value, String name) {
        VaultException.require(value != null && value.signum() >= 0 && value.compareTo(BigDecimal.ONE) < 0,
                VaultErrorCode.PARAMETER_OUT_OF_RANGE, name + " must be in [0, 1)");
        return FixedPoint.normalize(value);
    }
}
