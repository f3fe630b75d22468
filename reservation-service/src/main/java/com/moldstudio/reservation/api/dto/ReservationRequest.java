package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.CustomerFields;
import com.moldstudio.reservation.domain.model.DeliveryStatus;
import com.moldstudio.reservation.domain.model.PaymentStatus;
import com.moldstudio.reservation.domain.model.Reservation;
import com.moldstudio.reservation.domain.model.ReservationInput;
import com.moldstudio.reservation.domain.model.ReservationStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Create/update body for a reservation. Personal fields are stored on the customer,
 * the rest on the reservation. On update, omitted fields keep their stored value.
 */
public record ReservationRequest(
        @Size(max = 64) String customerId,
        LocalDate date,
        @Size(max = 10) String timeSlot,
        @Positive Integer duration,
        @Positive Integer moldCount,
        PaymentStatus paymentStatus,
        ReservationStatus reservationStatus,
        @Size(max = 100) String location,
        @Size(max = 100) String staffInCharge,
        DeliveryStatus deliveryStatus,
        Reservation.DeliveryMethod deliveryMethod,
        @Size(max = 255) String shippingAddress,
        LocalDate scheduledDeliveryDate,
        LocalDate actualDeliveryDate,
        @Size(max = 100) String engravingName,
        LocalDate engravingDate,
        Reservation.FontStyle fontStyle,
        String note,
        @Size(max = 100) String parentName,
        @Size(max = 100) String childName,
        @Min(0) Integer age,
        @Min(0) @Max(11) Integer ageMonths,
        @Size(max = 30) String phoneNumber,
        @Size(max = 255) String address,
        @Size(max = 255) String lineUrl
) {
    public ReservationInput toInput() {
        return new ReservationInput(
                customerId,
                date,
                timeSlot,
                duration,
                moldCount,
                paymentStatus,
                reservationStatus,
                location,
                staffInCharge,
                deliveryStatus,
                deliveryMethod,
                shippingAddress,
                scheduledDeliveryDate,
                actualDeliveryDate,
                engravingName,
                engravingDate,
                fontStyle,
                note,
                CustomerFields.personal(parentName, childName, age, ageMonths, phoneNumber, address, lineUrl)
        );
    }
}
