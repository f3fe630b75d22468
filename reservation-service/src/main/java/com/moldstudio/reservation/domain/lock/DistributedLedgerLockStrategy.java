package com.moldstudio.reservation.domain.lock;

import com.moldstudio.common.exception.ServiceUnavailableException;
import com.moldstudio.reservation.domain.model.IncentiveKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Ledger lock using Redis/Redisson distributed locks, one lock per (staff, date) key.
 *
 * Locks of a move are acquired in key order, so two moves between the same pair
 * of keys in opposite directions cannot deadlock. Each lock waits at most 5 seconds
 * and is leased for 30 seconds.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "studio.incentive.lock-strategy", havingValue = "distributed")
@RequiredArgsConstructor
public class DistributedLedgerLockStrategy implements LedgerLockStrategy {

    private static final long WAIT_SECONDS = 5;
    private static final long LEASE_SECONDS = 30;

    private final RedissonClient redissonClient;

    @Override
    public <T> T executeLocked(Collection<IncentiveKey> keys, Supplier<T> action) {
        TreeSet<IncentiveKey> ordered = new TreeSet<>();
        keys.stream().filter(Objects::nonNull).forEach(ordered::add);

        Deque<RLock> held = new ArrayDeque<>();
        try {
            for (IncentiveKey key : ordered) {
                RLock lock = redissonClient.getLock(key.lockName());
                boolean acquired = lock.tryLock(WAIT_SECONDS, LEASE_SECONDS, TimeUnit.SECONDS);
                if (!acquired) {
                    throw new ServiceUnavailableException(
                            "Unable to acquire incentive ledger lock for " + key + ". Please try again.");
                }
                held.push(lock);
                log.debug("Acquired distributed lock: {}", key.lockName());
            }
            return action.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Incentive ledger update interrupted", e);
        } finally {
            while (!held.isEmpty()) {
                RLock lock = held.pop();
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                    log.debug("Released distributed lock: {}", lock.getName());
                }
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
