package com.moldstudio.reservation.domain.model;

import com.moldstudio.common.util.PartialMerge;
import org.springframework.util.StringUtils;

import java.util.stream.Stream;

/**
 * Personal/contact fields of a customer as supplied by a caller. A {@code null} component
 * means "not provided" and never overwrites a stored value.
 */
public record CustomerFields(
        String parentName,
        String childName,
        Integer age,
        Integer ageMonths,
        String phoneNumber,
        String address,
        String lineUrl,
        String note,
        PaymentStatus paymentStatus,
        CustomerReservationStatus reservationStatus
) {

    public static CustomerFields empty() {
        return new CustomerFields(null, null, null, null, null, null, null, null, null, null);
    }

    public static CustomerFields personal(String parentName, String childName, Integer age, Integer ageMonths,
                                          String phoneNumber, String address, String lineUrl) {
        return new CustomerFields(parentName, childName, age, ageMonths, phoneNumber, address, lineUrl,
                null, null, null);
    }

    /**
     * These fields with every component present in {@code top} taking precedence.
     */
    public CustomerFields overlay(CustomerFields top) {
        return new CustomerFields(
                PartialMerge.resolve(top.parentName(), parentName),
                PartialMerge.resolve(top.childName(), childName),
                PartialMerge.resolve(top.age(), age),
                PartialMerge.resolve(top.ageMonths(), ageMonths),
                PartialMerge.resolve(top.phoneNumber(), phoneNumber),
                PartialMerge.resolve(top.address(), address),
                PartialMerge.resolve(top.lineUrl(), lineUrl),
                PartialMerge.resolve(top.note(), note),
                PartialMerge.resolve(top.paymentStatus(), paymentStatus),
                PartialMerge.resolve(top.reservationStatus(), reservationStatus));
    }

    public boolean isEmpty() {
        return Stream.of(parentName, childName, age, ageMonths, phoneNumber, address, lineUrl, note,
                        paymentStatus, reservationStatus)
                .allMatch(value -> value == null);
    }

    public boolean hasIdentity() {
        return StringUtils.hasText(parentName) || StringUtils.hasText(childName);
    }
}
