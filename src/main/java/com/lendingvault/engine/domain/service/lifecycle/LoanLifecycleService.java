package com.lendingvault.engine.domain.service.lifecycle;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.AssetTransfer;
import com.lendingvault.engine.domain.gateway.CollateralCustody;
import com.lendingvault.engine.domain.gateway.NoteCustody;
import com.lendingvault.engine.domain.gateway.ReceivableAdapter;
import com.lendingvault.engine.domain.gateway.ReceivableAdapters;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.Loan;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.LoanQuote;
import com.lendingvault.engine.domain.model.LoanStatus;
import com.lendingvault.engine.domain.model.LoanTerms;
import com.lendingvault.engine.domain.model.PurchaseResult;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.model.TrancheReturns;
import com.lendingvault.engine.domain.service.access.AccessPolicy;
import com.lendingvault.engine.domain.service.access.VaultRole;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import com.lendingvault.engine.domain.service.pricing.LoanPricer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Drives a note through purchase, repayment or default, and collateral liquidation.
 * <p>
 * Every operation reads the platform first, validates, mutates the ledger, and performs
 * transfers last.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanLifecycleService {

    private final TrancheLedger ledger;
    private final LoanPricer loanPricer;
    private final ReceivableAdapters receivableAdapters;
    private final AssetTransfer assetTransfer;
    private final NoteCustody noteCustody;
    private final CollateralCustody collateralCustody;
    private final AccessPolicy accessPolicy;

    public LoanQuote quote(LoanKey key) {
        ReceivableAdapter adapter = receivableAdapters.forPlatform(key.platform());
        VaultException.require(adapter.isSupported(key.loanId()), VaultErrorCode.UNSUPPORTED_NOTE_TOKEN, key.toString());
        LoanTerms terms = adapter.getLoanTerms(key.loanId());
        return quote(terms);
    }

    public PurchaseResult purchase(String seller, LoanKey key, BigDecimal minPurchasePrice) {
        Loan loan = preparePurchase(seller, key, minPurchasePrice);

        ledger.recordPurchase(loan);
        noteCustody.receiveNote(key, seller);
        try {
            assetTransfer.push(seller, loan.getPurchasePrice());
        } catch (RuntimeException e) {
            returnNote(key, seller, e);
            throw e;
        }

        log.info("[Lifecycle] note purchased: loan={}, seller={}, price={}",
                key, seller, loan.getPurchasePrice().toPlainString());
        return resultOf(loan, Map.of());
    }

    /**
     * Buys the note and deposits the purchase price on the seller's behalf instead of paying
     * cash out. {@code allocation} fractions must sum to exactly one.
     */
    public PurchaseResult purchaseAndDeposit(String seller, LoanKey key, BigDecimal minPurchasePrice,
                                             Map<TrancheId, BigDecimal> allocation) {
        BigDecimal seniorFraction = allocation.getOrDefault(TrancheId.SENIOR, BigDecimal.ZERO);
        BigDecimal juniorFraction = allocation.getOrDefault(TrancheId.JUNIOR, BigDecimal.ZERO);
        VaultException.require(seniorFraction.signum() >= 0 && juniorFraction.signum() >= 0
                        && seniorFraction.add(juniorFraction).compareTo(BigDecimal.ONE) == 0,
                VaultErrorCode.INVALID_ALLOCATION, "allocation=" + allocation);

        Loan loan = preparePurchase(seller, key, minPurchasePrice);
        ledger.recordPurchase(loan);

        BigDecimal seniorAmount = FixedPoint.mul(loan.getPurchasePrice(), seniorFraction);
        BigDecimal juniorAmount = FixedPoint.sub(loan.getPurchasePrice(), seniorAmount);
        Map<TrancheId, BigDecimal> shares = new EnumMap<>(TrancheId.class);
        if (FixedPoint.isPositive(seniorAmount)) {
            shares.put(TrancheId.SENIOR, ledger.deposit(TrancheId.SENIOR, seller, seniorAmount));
        }
        if (FixedPoint.isPositive(juniorAmount)) {
            shares.put(TrancheId.JUNIOR, ledger.deposit(TrancheId.JUNIOR, seller, juniorAmount));
        }
        noteCustody.receiveNote(key, seller);

        log.info("[Lifecycle] note purchased for deposit: loan={}, seller={}, price={}, senior={}, junior={}",
                key, seller, loan.getPurchasePrice().toPlainString(),
                seniorAmount.toPlainString(), juniorAmount.toPlainString());
        return resultOf(loan, shares);
    }

    public void onLoanRepaid(LoanKey key) {
        requireActive(key);
        ReceivableAdapter adapter = receivableAdapters.forPlatform(key.platform());
        VaultException.require(adapter.isRepaid(key.loanId()), VaultErrorCode.LOAN_NOT_REPAID, key.toString());

        ledger.realizeRepayment(key);
        log.info("[Lifecycle] loan repaid: loan={}", key);
    }

    /**
     * The platform has foreclosed and the collateral now sits with the vault.
     */
    public void onLoanLiquidated(LoanKey key) {
        requireActive(key);
        ReceivableAdapter adapter = receivableAdapters.forPlatform(key.platform());
        VaultException.require(adapter.isLiquidated(key.loanId()), VaultErrorCode.LOAN_NOT_LIQUIDATED, key.toString());

        ledger.applyDefault(key);
        log.warn("[Lifecycle] loan liquidated: loan={}", key);
    }

    /**
     * The loan is past maturity and unpaid: write it off and ask the platform to foreclose.
     */
    public void onLoanExpired(LoanKey key) {
        requireActive(key);
        ReceivableAdapter adapter = receivableAdapters.forPlatform(key.platform());
        VaultException.require(adapter.isExpired(key.loanId()) && !adapter.isRepaid(key.loanId()),
                VaultErrorCode.LOAN_NOT_EXPIRED, key.toString());

        ledger.applyDefault(key);
        adapter.liquidate(key.loanId());
        log.warn("[Lifecycle] loan expired and liquidated: loan={}", key);
    }

    public void withdrawCollateral(String caller, LoanKey key) {
        accessPolicy.requireRole(caller, VaultRole.COLLATERAL_LIQUIDATOR);

        ledger.markCollateralWithdrawn(key);
        Loan loan = ledger.loan(key)
                .orElseThrow(() -> new VaultException(VaultErrorCode.UNKNOWN_LOAN, key.toString()));
        collateralCustody.transferCollateral(loan.getCollateral(), caller);

        log.info("[Lifecycle] collateral withdrawn: loan={}, collateral={}, liquidator={}",
                key, loan.getCollateral(), caller);
    }

    public void onCollateralLiquidated(String caller, LoanKey key, BigDecimal proceeds) {
        accessPolicy.requireRole(caller, VaultRole.COLLATERAL_LIQUIDATOR);
        VaultException.require(proceeds != null && proceeds.signum() >= 0, VaultErrorCode.INVALID_AMOUNT);

        BigDecimal value = FixedPoint.normalize(proceeds);
        ledger.applyRecovery(key, value);
        if (value.signum() > 0) {
            assetTransfer.pull(caller, value);
        }
        log.info("[Lifecycle] collateral liquidated: loan={}, proceeds={}", key, value.toPlainString());
    }

    private Loan preparePurchase(String seller, LoanKey key, BigDecimal minPurchasePrice) {
        VaultException.require(seller != null && !seller.isBlank(), VaultErrorCode.INVALID_ADDRESS);
        VaultException.require(!ledger.isPaused(), VaultErrorCode.PAUSED);
        VaultException.require(minPurchasePrice != null && minPurchasePrice.signum() >= 0, VaultErrorCode.INVALID_AMOUNT);

        ReceivableAdapter adapter = receivableAdapters.forPlatform(key.platform());
        VaultException.require(adapter.isSupported(key.loanId()), VaultErrorCode.UNSUPPORTED_NOTE_TOKEN, key.toString());
        VaultException.require(ledger.loan(key).isEmpty(), VaultErrorCode.LOAN_ALREADY_PURCHASED, key.toString());

        LoanTerms terms = adapter.getLoanTerms(key.loanId());
        LoanQuote quote = quote(terms);
        BigDecimal purchasePrice = quote.purchasePrice();

        VaultException.require(purchasePrice.compareTo(minPurchasePrice) >= 0, VaultErrorCode.PRICE_MISMATCH,
                "price=" + purchasePrice.toPlainString() + ", minimum=" + minPurchasePrice.toPlainString());
        VaultException.require(terms.repayment().compareTo(purchasePrice) > 0, VaultErrorCode.REPAYMENT_TOO_LOW);
        VaultException.require(purchasePrice.compareTo(ledger.availableCash()) <= 0,
                VaultErrorCode.INSUFFICIENT_LIQUIDITY, "price=" + purchasePrice.toPlainString());

        TrancheReturns returns = ledger.computeTrancheReturns(purchasePrice, terms.repayment(),
                quote.durationRemaining());

        return Loan.builder()
                .key(key)
                .collateral(terms.collateral())
                .seller(seller)
                .purchasePrice(purchasePrice)
                .repayment(FixedPoint.normalize(terms.repayment()))
                .maturity(terms.maturity())
                .seniorReturn(returns.seniorReturn())
                .juniorReturn(returns.juniorReturn())
                .adminFee(returns.adminFee())
                .status(LoanStatus.ACTIVE)
                .build();
    }

    private LoanQuote quote(LoanTerms terms) {
        long durationRemaining = terms.maturity() - ledger.now();
        return loanPricer.priceLoan(terms.collateral(), terms.principal(), terms.repayment(),
                durationRemaining, ledger.utilization());
    }

    // the ledger rolls back with the failed command; the note has to be handed back explicitly
    private void returnNote(LoanKey key, String seller, RuntimeException cause) {
        try {
            noteCustody.returnNote(key, seller);
            log.warn("[Lifecycle] payout failed, note returned: loan={}, seller={}", key, seller);
        } catch (RuntimeException e) {
            log.error("[Lifecycle] payout failed and note could not be returned: loan={}, seller={}", key, seller, e);
            cause.addSuppressed(e);
        }
    }

    private void requireActive(LoanKey key) {
        boolean active = ledger.loan(key).map(Loan::isActive).orElse(false);
        VaultException.require(active, VaultErrorCode.UNKNOWN_LOAN, key.toString());
    }

    private static PurchaseResult resultOf(Loan loan, Map<TrancheId, BigDecimal> shares) {
        return new PurchaseResult(loan.getKey(), loan.getPurchasePrice(),
                new TrancheReturns(loan.getSeniorReturn(), loan.getJuniorReturn(), loan.getAdminFee()),
                loan.getMaturity(), shares);
    }
}
