package com.moldstudio.reservation.domain.repository;

import com.moldstudio.reservation.domain.model.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface ReservationRepository extends JpaRepository<Reservation, String> {

    List<Reservation> findByCustomerIdOrderByDateAscTimeSlotAsc(String customerId);

    /**
     * Reservations ordered by date then time slot. A {@code null} argument does not filter;
     * the date range is inclusive.
     */
    @Query("""
           SELECT r FROM Reservation r
           WHERE (:from IS NULL OR r.date >= :from)
             AND (:to IS NULL OR r.date <= :to)
             AND (:staff IS NULL OR r.staffInCharge = :staff)
             AND (:customerId IS NULL OR r.customerId = :customerId)
           ORDER BY r.date ASC, r.timeSlot ASC
           """)
    List<Reservation> search(@Param("from") LocalDate from,
                             @Param("to") LocalDate to,
                             @Param("staff") String staffInCharge,
                             @Param("customerId") String customerId);

    /**
     * Ids of reservations that still carry inline personal fields.
     */
    @Query("""
           SELECT r.id FROM Reservation r
           WHERE r.legacyPersonalInfo.parentName IS NOT NULL
              OR r.legacyPersonalInfo.childName IS NOT NULL
              OR r.legacyPersonalInfo.age IS NOT NULL
              OR r.legacyPersonalInfo.ageMonths IS NOT NULL
              OR r.legacyPersonalInfo.phoneNumber IS NOT NULL
              OR r.legacyPersonalInfo.address IS NOT NULL
              OR r.legacyPersonalInfo.lineUrl IS NOT NULL
           ORDER BY r.id
           """)
    List<String> findIdsWithLegacyPersonalInfo();
}
