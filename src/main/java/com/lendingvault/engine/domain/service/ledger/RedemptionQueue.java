package com.lendingvault.engine.domain.service.ledger;

import com.lendingvault.engine.domain.exception.VaultErrorCode;
import com.lendingvault.engine.domain.exception.VaultException;
import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.DepositorRedemption;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * FIFO redemption queue of one tranche. Positions are cumulative amounts: a depositor's
 * request occupies {@code (queueTarget - pending, queueTarget]} and is paid out as
 * {@code processed} advances through that range.
 */
class RedemptionQueue {

    private final Map<String, DepositorRedemption> depositors = new HashMap<>();
    private BigDecimal total = FixedPoint.ZERO;
    private BigDecimal processed = FixedPoint.ZERO;

    BigDecimal total() {
        return total;
    }

    BigDecimal processed() {
        return processed;
    }

    BigDecimal pending() {
        return FixedPoint.sub(total, processed);
    }

    boolean hasOutstanding(String account) {
        return depositors.containsKey(account);
    }

    /**
     * Copy of the depositor's record, empty when nothing is outstanding.
     */
    DepositorRedemption record(String account) {
        DepositorRedemption record = depositors.get(account);
        return record == null ? new DepositorRedemption() : record.copy();
    }

    BigDecimal available(String account) {
        DepositorRedemption record = depositors.get(account);
        return record == null ? FixedPoint.ZERO : record.available(processed);
    }

    void enqueue(String account, BigDecimal amount) {
        if (hasOutstanding(account)) {
            throw new VaultException(VaultErrorCode.REDEMPTION_IN_PROGRESS, "account=" + account);
        }
        total = FixedPoint.add(total, amount);

        DepositorRedemption record = new DepositorRedemption();
        record.setPending(amount);
        record.setQueueTarget(total);
        depositors.put(account, record);
    }

    void process(BigDecimal amount) {
        BigDecimal next = FixedPoint.add(processed, amount);
        if (next.compareTo(total) > 0) {
            throw new IllegalStateException("redemption queue processed beyond total");
        }
        processed = next;
    }

    void withdraw(String account, BigDecimal amount) {
        BigDecimal available = available(account);
        if (available.signum() <= 0 || amount.signum() <= 0 || amount.compareTo(available) > 0) {
            throw new VaultException(VaultErrorCode.INVALID_AMOUNT,
                    "requested=" + amount.toPlainString() + ", available=" + available.toPlainString());
        }
        DepositorRedemption record = depositors.get(account);
        record.setWithdrawn(FixedPoint.add(record.getWithdrawn(), amount));
        if (record.getWithdrawn().compareTo(record.getPending()) == 0) {
            depositors.remove(account);
        }
    }

    RedemptionQueue copy() {
        RedemptionQueue copy = new RedemptionQueue();
        depositors.forEach((account, record) -> copy.depositors.put(account, record.copy()));
        copy.total = total;
        copy.processed = processed;
        return copy;
    }
}
