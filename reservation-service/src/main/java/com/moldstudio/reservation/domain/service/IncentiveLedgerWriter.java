package com.moldstudio.reservation.domain.service;

import com.moldstudio.reservation.api.dto.LedgerCorrection;
import com.moldstudio.reservation.domain.model.IncentiveEntry;
import com.moldstudio.reservation.domain.model.IncentiveKey;
import com.moldstudio.reservation.domain.model.Reservation;
import com.moldstudio.reservation.domain.repository.IncentiveEntryRepository;
import com.moldstudio.reservation.domain.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Transactional ledger writes. Each public method is one transaction; locking and
 * retries are applied around it by {@link IncentiveLedgerService}.
 *
 * We never load an entry, change it in Java and save it back. Adjustments are a single
 * UPDATE with the delta applied in SQL, followed by a DELETE of the key if its count
 * is no longer positive, so a non-positive count is never committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncentiveLedgerWriter {

    private final IncentiveEntryRepository incentiveEntryRepository;
    private final ReservationRepository reservationRepository;

    /**
     * Applies {@code delta} to one key.
     *
     * @return the count after the adjustment, 0 when the key has no entry
     */
    @Transactional
    public int applyDelta(IncentiveKey key, int delta) {
        return adjust(key, delta);
    }

    /**
     * Moves one unit from {@code from} to {@code to} in a single transaction.
     * Either side may be {@code null} (the reservation did not count before, or does not count after).
     */
    @Transactional
    public void applyMove(IncentiveKey from, IncentiveKey to) {
        // Same order as the lock strategies, so concurrent moves take row locks in the same order
        if (from != null && to != null && to.compareTo(from) < 0) {
            adjust(to, 1);
            adjust(from, -1);
            return;
        }
        if (from != null) {
            adjust(from, -1);
        }
        if (to != null) {
            adjust(to, 1);
        }
    }

    /**
     * Recomputes every entry from the reservation store.
     *
     * @return the keys whose stored count was wrong
     */
    @Transactional
    public List<LedgerCorrection> rebuild() {
        Map<IncentiveKey, Long> derived = reservationRepository.findAll().stream()
                .map(Reservation::incentiveKey)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));

        Map<IncentiveKey, IncentiveEntry> stored = incentiveEntryRepository.findAll().stream()
                .collect(Collectors.toMap(IncentiveEntry::key, Function.identity(), (a, b) -> a, TreeMap::new));

        List<LedgerCorrection> corrections = new ArrayList<>();

        for (Map.Entry<IncentiveKey, IncentiveEntry> storedEntry : stored.entrySet()) {
            IncentiveKey key = storedEntry.getKey();
            IncentiveEntry entry = storedEntry.getValue();
            int actual = derived.getOrDefault(key, 0L).intValue();
            int previous = entry.getReservationCount();

            boolean amountDrifted = entry.getAmount() != IncentiveEntry.amountFor(previous);
            if (actual == previous && !amountDrifted) {
                continue;
            }
            if (entry.applyDelta(actual - previous)) {
                incentiveEntryRepository.save(entry);
            } else {
                incentiveEntryRepository.delete(entry);
            }
            corrections.add(new LedgerCorrection(key.staffInCharge(), key.date(), previous, actual));
        }

        derived.forEach((key, count) -> {
            if (!stored.containsKey(key)) {
                incentiveEntryRepository.save(IncentiveEntry.of(key, count.intValue()));
                corrections.add(new LedgerCorrection(key.staffInCharge(), key.date(), 0, count.intValue()));
            }
        });
        incentiveEntryRepository.flush();

        log.info("Incentive ledger rebuilt from {} keys, {} corrections", derived.size(), corrections.size());
        return corrections;
    }

    private int adjust(IncentiveKey key, int delta) {
        int updatedRows = incentiveEntryRepository.adjustAtomically(
                key.staffInCharge(), key.date(), delta, IncentiveEntry.REWARD_PER_RESERVATION, LocalDateTime.now());

        if (updatedRows == 0) {
            if (delta <= 0) {
                // Absent and zero are the same state; nothing to decrement
                log.debug("Ledger key {} absent, ignoring delta {}", key, delta);
                return 0;
            }
            // A concurrent first insert of the same key fails on the unique constraint and is retried
            incentiveEntryRepository.saveAndFlush(IncentiveEntry.of(key, delta));
            log.debug("Ledger key {} created with count {}", key, delta);
            return delta;
        }

        int removed = incentiveEntryRepository.deleteIfNotPositive(key.staffInCharge(), key.date());
        if (removed > 0) {
            log.debug("Ledger key {} removed after delta {}", key, delta);
            return 0;
        }
        int count = incentiveEntryRepository.findByStaffInChargeAndEntryDate(key.staffInCharge(), key.date())
                .map(IncentiveEntry::getReservationCount)
                .orElse(0);
        log.debug("Ledger key {} adjusted by {} to {}", key, delta, count);
        return count;
    }
}
