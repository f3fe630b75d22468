package com.moldstudio.reservation.domain.model;

import com.moldstudio.common.util.Constants;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Ledger key (staff in charge, reservation date).
 */
public record IncentiveKey(String staffInCharge, LocalDate date) implements Comparable<IncentiveKey> {

    private static final Comparator<IncentiveKey> ORDER = Comparator
            .comparing(IncentiveKey::date)
            .thenComparing(IncentiveKey::staffInCharge);

    public IncentiveKey {
        Objects.requireNonNull(staffInCharge, "staffInCharge");
        Objects.requireNonNull(date, "date");
    }

    /**
     * Key a reservation contributes to, or {@code null} when it has no staff or no date.
     */
    public static IncentiveKey of(String staffInCharge, LocalDate date) {
        if (!StringUtils.hasText(staffInCharge) || date == null) {
            return null;
        }
        return new IncentiveKey(staffInCharge.trim(), date);
    }

    public String lockName() {
        return Constants.LOCK_PREFIX + staffInCharge + ":" + date;
    }

    @Override
    public int compareTo(IncentiveKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + staffInCharge + ", " + date + ")";
    }
}
