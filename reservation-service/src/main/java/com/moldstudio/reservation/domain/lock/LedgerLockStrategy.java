package com.moldstudio.reservation.domain.lock;

import com.moldstudio.reservation.domain.model.IncentiveKey;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Strategy interface for serialising incentive ledger writers of the same (staff, date) key.
 *
 * Implementations (bean names):
 * - database: atomic row statements plus the unique key constraint, no extra lock
 * - distributed: Redisson locks across service instances, on top of the atomic statements
 */
public interface LedgerLockStrategy {

    /**
     * Runs {@code action} while holding the locks of every key in {@code keys}.
     * The action is expected to open and commit its own transaction.
     */
    <T> T executeLocked(Collection<IncentiveKey> keys, Supplier<T> action);

    /**
     * Returns the strategy type name for identification.
     */
    String getStrategyType();
}
