package com.moldstudio.reservation.domain.lock;

import com.moldstudio.reservation.domain.model.IncentiveKey;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Relies on the database alone: every adjustment is a single atomic UPDATE,
 * and a racing first insert hits the unique key and is retried by the caller.
 */
@Component("database")
public class DatabaseLedgerLockStrategy implements LedgerLockStrategy {

    @Override
    public <T> T executeLocked(Collection<IncentiveKey> keys, Supplier<T> action) {
        return action.get();
    }

    @Override
    public String getStrategyType() {
        return "DATABASE";
    }
}
