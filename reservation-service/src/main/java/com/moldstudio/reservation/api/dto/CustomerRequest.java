package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.CustomerFields;
import com.moldstudio.reservation.domain.model.CustomerReservationStatus;
import com.moldstudio.reservation.domain.model.PaymentStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Create/update body for a customer. Omitted fields keep their stored value on update.
 */
public record CustomerRequest(
        @Size(max = 64) String customerId,
        @Size(max = 100) String parentName,
        @Size(max = 100) String childName,
        @Min(0) Integer age,
        @Min(0) @Max(11) Integer ageMonths,
        @Size(max = 30) String phoneNumber,
        @Size(max = 255) String address,
        @Size(max = 255) String lineUrl,
        String note,
        PaymentStatus paymentStatus,
        CustomerReservationStatus reservationStatus
) {
    public CustomerFields toFields() {
        return new CustomerFields(parentName, childName, age, ageMonths, phoneNumber, address, lineUrl,
                note, paymentStatus, reservationStatus);
    }
}
