package com.moldstudio.reservation.domain.model;

import com.moldstudio.common.util.PartialMerge;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;

/**
 * Deduplicated customer record, one row per {@code customerId}.
 * Dynamic updates write only the changed columns, so concurrent updates of
 * different fields do not overwrite each other.
 */
@Entity
@Table(name = "customers", indexes = {
        @Index(name = "idx_customers_parent_name", columnList = "parent_name"),
        @Index(name = "idx_customers_created_at", columnList = "created_at")
})
@DynamicUpdate
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {
    @Id
    @Column(name = "customer_id", length = 64)
    private String customerId;

    @Column(name = "parent_name", nullable = false, length = 100)
    private String parentName;

    @Column(name = "child_name", nullable = false, length = 100)
    private String childName;

    @Column(name = "age_years", nullable = false)
    private Integer age;

    @Column(name = "age_months", nullable = false)
    private Integer ageMonths;

    @Column(name = "phone_number", nullable = false, length = 30)
    private String phoneNumber;

    @Column(name = "address", nullable = false, length = 255)
    private String address;

    @Column(name = "line_url", nullable = false, length = 255)
    private String lineUrl;

    @Column(name = "note", nullable = false, columnDefinition = "TEXT")
    private String note;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "reservation_status", nullable = false, length = 20)
    private CustomerReservationStatus reservationStatus;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static Customer newCustomer(String customerId, CustomerFields fields) {
        Customer customer = Customer.builder().customerId(customerId).build();
        customer.merge(fields);
        customer.applyDefaults();
        return customer;
    }

    /**
     * Overwrites every field present in {@code fields}; absent fields keep their value.
     *
     * @return true if at least one field was supplied
     */
    public boolean merge(CustomerFields fields) {
        return PartialMerge.start()
                .field(fields.parentName(), this::setParentName)
                .field(fields.childName(), this::setChildName)
                .field(fields.age(), this::setAge)
                .field(fields.ageMonths(), this::setAgeMonths)
                .field(fields.phoneNumber(), this::setPhoneNumber)
                .field(fields.address(), this::setAddress)
                .field(fields.lineUrl(), this::setLineUrl)
                .field(fields.note(), this::setNote)
                .field(fields.paymentStatus(), this::setPaymentStatus)
                .field(fields.reservationStatus(), this::setReservationStatus)
                .anyApplied();
    }

    public boolean hasIdentity() {
        return StringUtils.hasText(parentName) || StringUtils.hasText(childName);
    }

    /**
     * Age in months; {@code ageMonths} only counts for infants under one year.
     */
    public int getAgeInMonths() {
        int years = age == null ? 0 : age;
        if (years > 0) {
            return years * 12;
        }
        return ageMonths == null ? 0 : ageMonths;
    }

    @PrePersist
    protected void onCreate() {
        applyDefaults();
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    private void applyDefaults() {
        if (parentName == null) parentName = "";
        if (childName == null) childName = "";
        if (age == null) age = 0;
        if (ageMonths == null) ageMonths = 0;
        if (phoneNumber == null) phoneNumber = "";
        if (address == null) address = "";
        if (lineUrl == null) lineUrl = "";
        if (note == null) note = "";
        if (paymentStatus == null) paymentStatus = PaymentStatus.UNPAID;
        if (reservationStatus == null) reservationStatus = CustomerReservationStatus.NONE;
    }
}
