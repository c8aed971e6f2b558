package com.lendingvault.engine.domain.service.ledger;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.math.FixedPoint;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

class ShareRegistry {

    private final Map<String, BigDecimal> balances = new HashMap<>();
    private BigDecimal totalSupply = FixedPoint.ZERO;

    BigDecimal balanceOf(String account) {
        return balances.getOrDefault(account, FixedPoint.ZERO);
    }

    BigDecimal totalSupply() {
        return totalSupply;
    }

    void mint(String account, BigDecimal shares) {
        balances.put(account, FixedPoint.add(balanceOf(account), shares));
        totalSupply = FixedPoint.add(totalSupply, shares);
    }

    void burn(String account, BigDecimal shares) {
        BigDecimal balance = balanceOf(account);
        if (balance.compareTo(shares) < 0) {
            throw new VaultException(VaultErrorCode.INSUFFICIENT_SHARES,
                    "account=" + account + ", balance=" + balance.toPlainString());
        }
        BigDecimal remaining = FixedPoint.sub(balance, shares);
        if (FixedPoint.isZero(remaining)) {
            balances.remove(account);
        } else {
            balances.put(account, remaining);
        }
        totalSupply = FixedPoint.sub(totalSupply, shares);
    }

    ShareRegistry copy() {
        ShareRegistry copy = new ShareRegistry();
        copy.balances.putAll(balances);
        copy.totalSupply = totalSupply;
        return copy;
    }
}
