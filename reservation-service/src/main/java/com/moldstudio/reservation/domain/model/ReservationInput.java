package com.moldstudio.reservation.domain.model;

import java.time.LocalDate;

/**
 * Caller-supplied reservation fields for create and update. Every component is optional;
 * {@code null} means "not provided". Personal fields travel in {@link #customer()} and are
 * written to the customer registry, never to the reservation row.
 */
public record ReservationInput(
        String customerId,
        LocalDate date,
        String timeSlot,
        Integer duration,
        Integer moldCount,
        PaymentStatus paymentStatus,
        ReservationStatus reservationStatus,
        String location,
        String staffInCharge,
        DeliveryStatus deliveryStatus,
        Reservation.DeliveryMethod deliveryMethod,
        String shippingAddress,
        LocalDate scheduledDeliveryDate,
        LocalDate actualDeliveryDate,
        String engravingName,
        LocalDate engravingDate,
        Reservation.FontStyle fontStyle,
        String note,
        CustomerFields customer
) {

    public ReservationInput {
        if (customer == null) {
            customer = CustomerFields.empty();
        }
    }

    public static ReservationInput empty() {
        return new ReservationInput(null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, CustomerFields.empty());
    }
}
