package com.lendingvault.engine.domain.service;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.gateway.AssetTransfer;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.TrancheId;
import com.lendingvault.engine.domain.service.ledger.TrancheLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Depositor operations: ledger first, asset movement last.
 */
@Service
@RequiredArgsConstructor
public class VaultService {

    private final TrancheLedger ledger;
    private final AssetTransfer assetTransfer;

    public BigDecimal deposit(String account, TrancheId tranche, BigDecimal amount) {
        BigDecimal value = TrancheLedger.positiveAmount(amount);
        BigDecimal shares = ledger.deposit(tranche, account, value);
        assetTransfer.pull(account, value);
        return shares;
    }

    /**
     * Deposits into several tranches as one unit: every leg is booked before a single pull of the total.
     *
     * @return shares minted per tranche
     */
    public Map<TrancheId, BigDecimal> depositMany(String account, Map<TrancheId, BigDecimal> amounts) {
        VaultException.require(amounts != null && !amounts.isEmpty(), VaultErrorCode.INVALID_AMOUNT, "no deposits");
        Map<TrancheId, BigDecimal> legs = new EnumMap<>(amounts);

        Map<TrancheId, BigDecimal> shares = new EnumMap<>(TrancheId.class);
        BigDecimal total = FixedPoint.ZERO;
        for (Map.Entry<TrancheId, BigDecimal> leg : legs.entrySet()) {
            BigDecimal value = TrancheLedger.positiveAmount(leg.getValue());
            shares.put(leg.getKey(), ledger.deposit(leg.getKey(), account, value));
            total = FixedPoint.add(total, value);
        }
        assetTransfer.pull(account, total);
        return Collections.unmodifiableMap(shares);
    }

    public BigDecimal redeem(String account, TrancheId tranche, BigDecimal shares) {
        return ledger.redeem(tranche, account, shares);
    }

    public BigDecimal withdraw(String account, TrancheId tranche, BigDecimal amount) {
        BigDecimal withdrawn = ledger.withdraw(tranche, account, amount);
        assetTransfer.push(account, withdrawn);
        return withdrawn;
    }

    public BigDecimal withdrawMaximum(String account, TrancheId tranche) {
        BigDecimal withdrawn = ledger.withdrawMaximum(tranche, account);
        assetTransfer.push(account, withdrawn);
        return withdrawn;
    }
}
