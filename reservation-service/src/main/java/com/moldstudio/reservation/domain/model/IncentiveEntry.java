package com.moldstudio.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Incentive ledger row for one (staff, date) key.
 * Invariants: {@code amount == reservationCount * REWARD_PER_RESERVATION} and
 * {@code reservationCount > 0}; a key whose count drops to zero has no row.
 */
@Entity
@Table(name = "incentive_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_incentive_staff_date",
                columnNames = {"staff_in_charge", "entry_date"}),
        indexes = @Index(name = "idx_incentive_entry_date", columnList = "entry_date"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncentiveEntry {

    public static final long REWARD_PER_RESERVATION = 1000L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "staff_in_charge", nullable = false, length = 100)
    private String staffInCharge;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(name = "reservation_count", nullable = false)
    private Integer reservationCount;

    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static IncentiveEntry of(IncentiveKey key, int count) {
        return IncentiveEntry.builder()
                .staffInCharge(key.staffInCharge())
                .entryDate(key.date())
                .reservationCount(count)
                .amount(amountFor(count))
                .updatedAt(LocalDateTime.now())
                .build();
    }

    public static long amountFor(long count) {
        return count * REWARD_PER_RESERVATION;
    }

    public IncentiveKey key() {
        return new IncentiveKey(staffInCharge, entryDate);
    }

    /**
     * Adds {@code delta} to the count and recomputes the amount.
     *
     * @return false when the resulting count is not positive and the row must be removed
     */
    public boolean applyDelta(int delta) {
        reservationCount = reservationCount + delta;
        amount = amountFor(reservationCount);
        updatedAt = LocalDateTime.now();
        return reservationCount > 0;
    }
}
