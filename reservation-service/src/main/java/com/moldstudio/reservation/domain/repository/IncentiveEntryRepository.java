package com.moldstudio.reservation.domain.repository;

import com.moldstudio.reservation.domain.model.IncentiveEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the incentive ledger.
 */
public interface IncentiveEntryRepository extends JpaRepository<IncentiveEntry, Long> {

    Optional<IncentiveEntry> findByStaffInChargeAndEntryDate(String staffInCharge, LocalDate entryDate);

    List<IncentiveEntry> findAllByOrderByEntryDateAscStaffInChargeAsc();

    List<IncentiveEntry> findByEntryDateBetweenOrderByEntryDateAscStaffInChargeAsc(LocalDate from, LocalDate to);

    List<IncentiveEntry> findByStaffInChargeOrderByEntryDateAsc(String staffInCharge);

    List<IncentiveEntry> findByStaffInChargeAndEntryDateBetweenOrderByEntryDateAsc(
            String staffInCharge, LocalDate from, LocalDate to);

    /**
     * Atomically adds {@code delta} to the count of one key and recomputes the amount
     * in the same statement, so concurrent adjustments of the key never lose an update.
     *
     * Returns the number of rows affected:
     * - 1: the entry existed and was adjusted
     * - 0: no entry for the key
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE IncentiveEntry e
           SET e.reservationCount = e.reservationCount + :delta,
               e.amount = (e.reservationCount + :delta) * :reward,
               e.updatedAt = :now
           WHERE e.staffInCharge = :staff
             AND e.entryDate = :date
           """)
    int adjustAtomically(@Param("staff") String staffInCharge,
                         @Param("date") LocalDate date,
                         @Param("delta") int delta,
                         @Param("reward") long reward,
                         @Param("now") LocalDateTime now);

    /**
     * Removes the entry of one key if its count is no longer positive.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           DELETE FROM IncentiveEntry e
           WHERE e.staffInCharge = :staff
             AND e.entryDate = :date
             AND e.reservationCount <= 0
           """)
    int deleteIfNotPositive(@Param("staff") String staffInCharge, @Param("date") LocalDate date);
}
