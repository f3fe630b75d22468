package com.moldstudio.reservation.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class StatusCycleTest {

    @Test
    @DisplayName("payment status cycles paid -> unpaid -> pending -> paid")
    void paymentStatus_cycle() {
        assertThat(PaymentStatus.PAID.next()).isEqualTo(PaymentStatus.UNPAID);
        assertThat(PaymentStatus.UNPAID.next()).isEqualTo(PaymentStatus.PENDING);
        assertThat(PaymentStatus.PENDING.next()).isEqualTo(PaymentStatus.PAID);
    }

    @Test
    @DisplayName("delivery status cycles pending -> shipped -> completed -> pending")
    void deliveryStatus_cycle() {
        assertThat(DeliveryStatus.PENDING.next()).isEqualTo(DeliveryStatus.SHIPPED);
        assertThat(DeliveryStatus.SHIPPED.next()).isEqualTo(DeliveryStatus.COMPLETED);
        assertThat(DeliveryStatus.COMPLETED.next()).isEqualTo(DeliveryStatus.PENDING);
    }

    @Test
    @DisplayName("every cycle returns to its start after one full turn")
    void cycles_areClosed() {
        for (PaymentStatus status : PaymentStatus.values()) {
            assertThat(status.next().next().next()).isEqualTo(status);
        }
        for (DeliveryStatus status : DeliveryStatus.values()) {
            assertThat(status.next().next().next()).isEqualTo(status);
        }
        for (ReservationStatus status : ReservationStatus.values()) {
            assertThat(status.next().next()).isEqualTo(status);
        }
    }

    @Test
    @DisplayName("reservation advances a missing delivery status as if it were pending")
    void reservation_advanceDelivery_fromAbsent() {
        Reservation reservation = new Reservation();

        assertThat(reservation.advanceDeliveryStatus()).isEqualTo(DeliveryStatus.SHIPPED);
        assertThat(reservation.advanceDeliveryStatus()).isEqualTo(DeliveryStatus.COMPLETED);
        assertThat(reservation.advanceDeliveryStatus()).isEqualTo(DeliveryStatus.PENDING);
    }

    @Test
    @DisplayName("reservation status toggles standby and confirmed without touching the ledger key")
    void reservation_toggleStatus_keepsKey() {
        Reservation reservation = Reservation.builder()
                .staffInCharge("佐藤")
                .date(LocalDate.of(2025, 10, 27))
                .reservationStatus(ReservationStatus.STANDBY)
                .build();
        IncentiveKey before = reservation.incentiveKey();

        assertThat(reservation.toggleReservationStatus()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(reservation.toggleReservationStatus()).isEqualTo(ReservationStatus.STANDBY);
        assertThat(reservation.incentiveKey()).isEqualTo(before);
    }
}
