package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.Customer;
import com.moldstudio.reservation.domain.model.DeliveryStatus;
import com.moldstudio.reservation.domain.model.PaymentStatus;
import com.moldstudio.reservation.domain.model.Reservation;
import com.moldstudio.reservation.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reservation joined with its customer for display.
 * {@code customer} is null when the referenced customer no longer exists.
 */
public record ReservationResponse(
        String id,
        LocalDate date,
        String timeSlot,
        Integer duration,
        String customerId,
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
        String createdBy,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        CustomerSource customerSource,
        CustomerResponse customer
) {
    public enum CustomerSource {
        REGISTRY,
        LEGACY,
        UNAVAILABLE
    }

    public static ReservationResponse from(Reservation reservation, Customer customer) {
        CustomerSource source;
        CustomerResponse customerView;
        if (customer != null) {
            source = CustomerSource.REGISTRY;
            customerView = CustomerResponse.from(customer);
        } else if (reservation.hasLegacyPersonalInfo()) {
            // Not yet migrated: show the fields stored on the reservation itself
            source = CustomerSource.LEGACY;
            customerView = CustomerResponse.from(Customer.newCustomer(
                    reservation.getCustomerId(), reservation.getLegacyPersonalInfo().toCustomerFields()));
        } else {
            source = CustomerSource.UNAVAILABLE;
            customerView = null;
        }

        return new ReservationResponse(
                reservation.getId(),
                reservation.getDate(),
                reservation.getTimeSlot(),
                reservation.getDuration(),
                reservation.getCustomerId(),
                reservation.getMoldCount(),
                reservation.getPaymentStatus(),
                reservation.getReservationStatus(),
                reservation.getLocation(),
                reservation.getStaffInCharge(),
                reservation.getDeliveryStatus(),
                reservation.getDeliveryMethod(),
                reservation.getShippingAddress(),
                reservation.getScheduledDeliveryDate(),
                reservation.getActualDeliveryDate(),
                reservation.getEngravingName(),
                reservation.getEngravingDate(),
                reservation.getFontStyle(),
                reservation.getNote(),
                reservation.getCreatedBy(),
                reservation.getCreatedAt(),
                reservation.getUpdatedAt(),
                source,
                customerView
        );
    }
}
