package com.lendingvault.engine.infra.disruptor;

import com.lendingvault.engine.domain.model.CollateralRiskParameters;
import com.lendingvault.engine.domain.model.LoanKey;
import com.lendingvault.engine.domain.model.PurchaseResult;
import com.lendingvault.engine.domain.model.RateModel;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.model.UpkeepTask;
import com.lendingvault.engine.domain.service.VaultAdminService;
import com.lendingvault.engine.domain.service.VaultService;
import com.lendingvault.engine.domain.service.lifecycle.LoanLifecycleService;
import com.lendingvault.engine.domain.service.lifecycle.LoanUpkeepService;
import com.lendingvault.engine.infra.disruptor.event.CommandType;
import com.lendingvault.engine.infra.disruptor.event.LedgerCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Routes every mutating vault operation through the command dispatcher.
 */
@Service
@RequiredArgsConstructor
public class VaultCommandService {

    private final LedgerCommandDispatcher dispatcher;
    private final VaultService vaultService;
    private final LoanLifecycleService lifecycleService;
    private final LoanUpkeepService upkeepService;
    private final VaultAdminService adminService;

    public BigDecimal deposit(String account, TrancheId tranche, BigDecimal amount) {
        return dispatcher.execute(LedgerCommand.depositor(CommandType.DEPOSIT, account, tranche, amount),
                () -> vaultService.deposit(account, tranche, amount));
    }

    public Map<TrancheId, BigDecimal> depositMany(String account, Map<TrancheId, BigDecimal> amounts) {
        return dispatcher.execute(LedgerCommand.depositor(CommandType.DEPOSIT_MANY, account, null, null),
                () -> vaultService.depositMany(account, amounts));
    }

    public BigDecimal redeem(String account, TrancheId tranche, BigDecimal shares) {
        return dispatcher.execute(LedgerCommand.depositor(CommandType.REDEEM, account, tranche, shares),
                () -> vaultService.redeem(account, tranche, shares));
    }

    public BigDecimal withdraw(String account, TrancheId tranche, BigDecimal amount) {
        return dispatcher.execute(LedgerCommand.depositor(CommandType.WITHDRAW, account, tranche, amount),
                () -> vaultService.withdraw(account, tranche, amount));
    }

    public BigDecimal withdrawMaximum(String account, TrancheId tranche) {
        return dispatcher.execute(LedgerCommand.depositor(CommandType.WITHDRAW_MAXIMUM, account, tranche, null),
                () -> vaultService.withdrawMaximum(account, tranche));
    }

    public PurchaseResult purchase(String seller, LoanKey key, BigDecimal minPurchasePrice) {
        return dispatcher.execute(LedgerCommand.loan(CommandType.PURCHASE, seller, key, minPurchasePrice),
                () -> lifecycleService.purchase(seller, key, minPurchasePrice));
    }

    public PurchaseResult purchaseAndDeposit(String seller, LoanKey key, BigDecimal minPurchasePrice,
                                             Map<TrancheId, BigDecimal> allocation) {
        return dispatcher.execute(LedgerCommand.loan(CommandType.PURCHASE_AND_DEPOSIT, seller, key, minPurchasePrice),
                () -> lifecycleService.purchaseAndDeposit(seller, key, minPurchasePrice, allocation));
    }

    public void onLoanRepaid(LoanKey key) {
        dispatcher.run(LedgerCommand.loan(CommandType.LOAN_REPAID, null, key, null),
                () -> lifecycleService.onLoanRepaid(key));
    }

    public void onLoanLiquidated(LoanKey key) {
        dispatcher.run(LedgerCommand.loan(CommandType.LOAN_LIQUIDATED, null, key, null),
                () -> lifecycleService.onLoanLiquidated(key));
    }

    public void onLoanExpired(LoanKey key) {
        dispatcher.run(LedgerCommand.loan(CommandType.LOAN_EXPIRED, null, key, null),
                () -> lifecycleService.onLoanExpired(key));
    }

    public void withdrawCollateral(String caller, LoanKey key) {
        dispatcher.run(LedgerCommand.loan(CommandType.COLLATERAL_WITHDRAWN, caller, key, null),
                () -> lifecycleService.withdrawCollateral(caller, key));
    }

    public void onCollateralLiquidated(String caller, LoanKey key, BigDecimal proceeds) {
        dispatcher.run(LedgerCommand.loan(CommandType.COLLATERAL_LIQUIDATED, caller, key, proceeds),
                () -> lifecycleService.onCollateralLiquidated(caller, key, proceeds));
    }

    /**
     * Looks for due work outside the pipeline and performs it inside; the lifecycle operation
     * re-validates against the platform before mutating.
     */
    public Optional<UpkeepTask> performUpkeep() {
        Optional<UpkeepTask> task = upkeepService.checkUpkeep();
        task.ifPresent(t -> dispatcher.run(LedgerCommand.loan(CommandType.UPKEEP, null, t.loanKey(), null),
                () -> upkeepService.performUpkeep(t)));
        return task;
    }

    public void setUtilizationModel(String caller, RateModel model) {
        dispatcher.run(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, caller),
                () -> adminService.setUtilizationModel(caller, model));
    }

    public void setCollateralParameters(String caller, String collateralClass, CollateralRiskParameters parameters) {
        dispatcher.run(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, caller),
                () -> adminService.setCollateralParameters(caller, collateralClass, parameters));
    }

    public void setCollateralValue(String caller, String collateralClass, String tokenId, BigDecimal value) {
        dispatcher.run(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, caller),
                () -> adminService.setCollateralValue(caller, collateralClass, tokenId, value));
    }

    public void setSeniorTrancheRate(String caller, BigDecimal annualRate) {
        dispatcher.run(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, caller),
                () -> adminService.setSeniorTrancheRate(caller, annualRate));
    }

    public void setReserveRatio(String caller, BigDecimal ratio) {
        dispatcher.run(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, caller),
                () -> adminService.setReserveRatio(caller, ratio));
    }

    public void setAdminFeeRate(String caller, BigDecimal rate) {
        dispatcher.run(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, caller),
                () -> adminService.setAdminFeeRate(caller, rate));
    }

    public void setPaused(String caller, boolean paused) {
        dispatcher.run(LedgerCommand.admin(CommandType.ADMIN_PARAMETERS, caller),
                () -> adminService.setPaused(caller, paused));
    }

    public BigDecimal withdrawAdminFees(String caller, String to, BigDecimal amount) {
        return dispatcher.execute(
                new LedgerCommand(CommandType.ADMIN_FEE_WITHDRAWAL, caller, null, null, amount),
                () -> adminService.withdrawAdminFees(caller, to, amount));
    }
}
