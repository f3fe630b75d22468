package com.moldstudio.reservation.domain.service;

import com.moldstudio.reservation.api.dto.IncentiveEntryResponse;
import com.moldstudio.reservation.api.dto.IncentiveSummaryResponse;
import com.moldstudio.reservation.api.dto.LedgerCorrection;
import com.moldstudio.reservation.domain.lock.LedgerLockStrategy;
import com.moldstudio.reservation.domain.model.IncentiveEntry;
import com.moldstudio.reservation.domain.model.IncentiveKey;
import com.moldstudio.reservation.domain.repository.IncentiveEntryRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Incentive ledger: per (staff, date) reservation counts and reward amounts.
 *
 * Uses the same strategy selection as the rest of the service: every
 * {@link LedgerLockStrategy} bean is injected into a Map keyed by bean name, and
 * {@code studio.incentive.lock-strategy} picks one (database | distributed).
 *
 * Writes hold the lock around the whole transaction: the lock is taken first,
 * {@link IncentiveLedgerWriter} then opens and commits the transaction, and only then
 * is the lock released. A lost race on the first insert of a key is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncentiveLedgerService {

    private static final String DEFAULT_STRATEGY = "database";

    private final Map<String, LedgerLockStrategy> lockStrategies;
    private final IncentiveLedgerWriter ledgerWriter;
    private final IncentiveEntryRepository incentiveEntryRepository;

    @Value("${studio.incentive.lock-strategy:database}")
    private String strategyType;

    @PostConstruct
    public void init() {
        LedgerLockStrategy strategy = getLockStrategy();
        log.info("Initialized IncentiveLedgerService with strategy: {}", strategy.getStrategyType());
    }

    /**
     * Adds {@code delta} to the entry of {@code key}; the entry is created on the first
     * positive delta and removed once its count is no longer positive.
     *
     * @return the resulting count, 0 when the key has no entry
     */
    @Retryable(retryFor = {DataIntegrityViolationException.class, CannotAcquireLockException.class},
            maxAttempts = 3, backoff = @Backoff(delay = 50, multiplier = 2))
    public int adjust(IncentiveKey key, int delta) {
        Objects.requireNonNull(key, "key");
        if (delta == 0) {
            return get(key).map(IncentiveEntryResponse::count).orElse(0);
        }
        return getLockStrategy().executeLocked(List.of(key), () -> ledgerWriter.applyDelta(key, delta));
    }

    /**
     * Moves one reservation's unit from {@code from} to {@code to} as one logical step.
     * Either key may be {@code null}; equal keys are a no-op.
     */
    @Retryable(retryFor = {DataIntegrityViolationException.class, CannotAcquireLockException.class},
            maxAttempts = 3, backoff = @Backoff(delay = 50, multiplier = 2))
    public void move(IncentiveKey from, IncentiveKey to) {
        if (Objects.equals(from, to)) {
            return;
        }
        List<IncentiveKey> keys = Stream.of(from, to).filter(Objects::nonNull).toList();
        getLockStrategy().executeLocked(keys, () -> {
            ledgerWriter.applyMove(from, to);
            return null;
        });
        log.debug("Moved ledger unit from {} to {}", from, to);
    }

    /**
     * Recomputes the whole ledger from the reservation store.
     */
    public List<LedgerCorrection> rebuild() {
        List<LedgerCorrection> corrections = ledgerWriter.rebuild();
        if (!corrections.isEmpty()) {
            log.warn("Incentive ledger rebuild corrected {} keys: {}", corrections.size(), corrections);
        }
        return corrections;
    }

    @Transactional(readOnly = true)
    public Optional<IncentiveEntryResponse> get(IncentiveKey key) {
        return incentiveEntryRepository.findByStaffInChargeAndEntryDate(key.staffInCharge(), key.date())
                .map(IncentiveEntryResponse::from);
    }

    /**
     * Entries ordered by date then staff, optionally restricted to one month and/or one staff member.
     */
    @Transactional(readOnly = true)
    public List<IncentiveEntryResponse> list(YearMonth month, String staffInCharge) {
        List<IncentiveEntry> entries;
        boolean byStaff = StringUtils.hasText(staffInCharge);
        if (month != null) {
            LocalDate from = month.atDay(1);
            LocalDate to = month.atEndOfMonth();
            entries = byStaff
                    ? incentiveEntryRepository.findByStaffInChargeAndEntryDateBetweenOrderByEntryDateAsc(
                            staffInCharge.trim(), from, to)
                    : incentiveEntryRepository.findByEntryDateBetweenOrderByEntryDateAscStaffInChargeAsc(from, to);
        } else {
            entries = byStaff
                    ? incentiveEntryRepository.findByStaffInChargeOrderByEntryDateAsc(staffInCharge.trim())
                    : incentiveEntryRepository.findAllByOrderByEntryDateAscStaffInChargeAsc();
        }
        return entries.stream().map(IncentiveEntryResponse::from).toList();
    }

    /**
     * Per-staff totals for one month, ordered by staff.
     */
    @Transactional(readOnly = true)
    public List<IncentiveSummaryResponse> summary(YearMonth month) {
        Objects.requireNonNull(month, "month");
        Map<String, long[]> totals = new TreeMap<>();
        for (IncentiveEntry entry : incentiveEntryRepository
                .findByEntryDateBetweenOrderByEntryDateAscStaffInChargeAsc(month.atDay(1), month.atEndOfMonth())) {
            long[] total = totals.computeIfAbsent(entry.getStaffInCharge(), staff -> new long[2]);
            total[0] += entry.getReservationCount();
            total[1] += entry.getAmount();
        }
        List<IncentiveSummaryResponse> summaries = new ArrayList<>();
        totals.forEach((staff, total) ->
                summaries.add(new IncentiveSummaryResponse(month.toString(), staff, total[0], total[1])));
        return summaries;
    }

    private LedgerLockStrategy getLockStrategy() {
        String strategyKey = strategyType.toLowerCase();
        LedgerLockStrategy strategy = lockStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, lockStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = lockStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " lock strategy not found. Available strategies: "
                                + lockStrategies.keySet());
            }
        }
        return strategy;
    }
}
