package com.lendingvault.engine.domain.service.ledger;

import com.lendingvault.engine.domain.math.FixedPoint;
import com.lendingvault.engine.domain.model.TrancheId;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scheduled, not yet realized tranche returns keyed by maturity time bucket.
 * Buckets are dropped as soon as both tranches reach zero.
 */
class PendingReturnSchedule {

    private final TreeMap<Long, EnumMap<TrancheId, BigDecimal>> buckets = new TreeMap<>();

    void schedule(long bucket, TrancheId tranche, BigDecimal amount) {
        EnumMap<TrancheId, BigDecimal> entry = buckets.computeIfAbsent(bucket, b -> emptyEntry());
        entry.put(tranche, FixedPoint.add(entry.get(tranche), amount));
    }

    void unschedule(long bucket, TrancheId tranche, BigDecimal amount) {
        EnumMap<TrancheId, BigDecimal> entry = buckets.get(bucket);
        if (entry == null) {
            if (FixedPoint.isZero(amount)) {
                return;
            }
            throw new IllegalStateException("no pending returns in bucket " + bucket);
        }
        entry.put(tranche, FixedPoint.sub(entry.get(tranche), amount));
        if (entry.values().stream().allMatch(FixedPoint::isZero)) {
            buckets.remove(bucket);
        }
    }

    BigDecimal pending(long bucket, TrancheId tranche) {
        EnumMap<TrancheId, BigDecimal> entry = buckets.get(bucket);
        return entry == null ? FixedPoint.ZERO : entry.get(tranche);
    }

    /**
     * Sum of returns scheduled in the {@code bucketCount} buckets starting at the current one,
     * each accrued linearly over a window of {@code bucketCount} buckets ending at its bucket.
     */
    BigDecimal prorated(TrancheId tranche, long now, long bucketWidth, int bucketCount) {
        long currentBucket = Math.floorDiv(now, bucketWidth);
        long elapsedIntoBucket = now - currentBucket * bucketWidth;
        BigDecimal windowWidth = BigDecimal.valueOf(bucketWidth * bucketCount);

        BigDecimal total = FixedPoint.ZERO;
        for (int i = 0; i < bucketCount; i++) {
            BigDecimal amount = pending(currentBucket + i, tranche);
            if (FixedPoint.isZero(amount)) {
                continue;
            }
            long elapsedIntoWindow = elapsedIntoBucket + bucketWidth * (bucketCount - 1 - i);
            total = FixedPoint.add(total,
                    FixedPoint.mulDiv(amount, BigDecimal.valueOf(elapsedIntoWindow), windowWidth));
        }
        return total;
    }

    int size() {
        return buckets.size();
    }

    PendingReturnSchedule copy() {
        PendingReturnSchedule copy = new PendingReturnSchedule();
        for (Map.Entry<Long, EnumMap<TrancheId, BigDecimal>> entry : buckets.entrySet()) {
            copy.buckets.put(entry.getKey(), new EnumMap<>(entry.getValue()));
        }
        return copy;
    }

    private static EnumMap<TrancheId, BigDecimal> emptyEntry() {
        EnumMap<TrancheId, BigDecimal> entry = new EnumMap<>(TrancheId.class);
        for (TrancheId id : TrancheId.values()) {
            entry.put(id, FixedPoint.ZERO);
        }
        return entry;
    }
}
