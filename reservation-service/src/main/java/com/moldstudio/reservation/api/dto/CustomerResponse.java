package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.Customer;
import com.moldstudio.reservation.domain.model.CustomerReservationStatus;
import com.moldstudio.reservation.domain.model.PaymentStatus;

import java.time.LocalDateTime;

public record CustomerResponse(
        String customerId,
        String parentName,
        String childName,
        Integer age,
        Integer ageMonths,
        int ageInMonths,
        String phoneNumber,
        String address,
        String lineUrl,
        String note,
        PaymentStatus paymentStatus,
        CustomerReservationStatus reservationStatus,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static CustomerResponse from(Customer customer) {
        return new CustomerResponse(
                customer.getCustomerId(),
                customer.getParentName(),
                customer.getChildName(),
                customer.getAge(),
                customer.getAgeMonths(),
                customer.getAgeInMonths(),
                customer.getPhoneNumber(),
                customer.getAddress(),
                customer.getLineUrl(),
                customer.getNote(),
                customer.getPaymentStatus(),
                customer.getReservationStatus(),
                customer.getCreatedAt(),
                customer.getUpdatedAt()
        );
    }
}
