package com.moldstudio.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.moldstudio.common.util.PartialMerge;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One scheduled molding appointment. References its customer by {@code customerId};
 * {@link #legacyPersonalInfo} is only populated on rows written before the customer registry existed.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_date", columnList = "reservation_date"),
        @Index(name = "idx_reservations_customer", columnList = "customer_id"),
        @Index(name = "idx_reservations_staff_date", columnList = "staff_in_charge,reservation_date")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {
    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "reservation_date", nullable = false)
    private LocalDate date;

    @Column(name = "time_slot", length = 10)
    private String timeSlot;

    @Column(name = "duration_minutes")
    private Integer duration;

    @Column(name = "customer_id", length = 64)
    private String customerId;

    @Column(name = "mold_count", nullable = false)
    private Integer moldCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "reservation_status", nullable = false, length = 20)
    private ReservationStatus reservationStatus;

    @Column(name = "location", length = 100)
    private String location;

    @Column(name = "staff_in_charge", length = 100)
    private String staffInCharge;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", length = 20)
    private DeliveryStatus deliveryStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_method", length = 20)
    private DeliveryMethod deliveryMethod;

    @Column(name = "shipping_address", length = 255)
    private String shippingAddress;

    @Column(name = "scheduled_delivery_date")
    private LocalDate scheduledDeliveryDate;

    @Column(name = "actual_delivery_date")
    private LocalDate actualDeliveryDate;

    @Column(name = "engraving_name", length = 100)
    private String engravingName;

    @Column(name = "engraving_date")
    private LocalDate engravingDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "font_style", length = 20)
    private FontStyle fontStyle;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Embedded
    private LegacyPersonalInfo legacyPersonalInfo;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Field-by-field merge of the reservation part of {@code input}. Personal fields are ignored.
     */
    public void merge(ReservationInput input) {
        PartialMerge.start()
                .field(input.customerId(), this::setCustomerId)
                .field(input.date(), this::setDate)
                .field(input.timeSlot(), this::setTimeSlot)
                .field(input.duration(), this::setDuration)
                .field(input.moldCount(), this::setMoldCount)
                .field(input.paymentStatus(), this::setPaymentStatus)
                .field(input.reservationStatus(), this::setReservationStatus)
                .field(input.location(), this::setLocation)
                .field(input.staffInCharge(), value -> setStaffInCharge(StringUtils.hasText(value) ? value.trim() : null))
                .field(input.deliveryStatus(), this::setDeliveryStatus)
                .field(input.deliveryMethod(), this::setDeliveryMethod)
                .field(input.shippingAddress(), this::setShippingAddress)
                .field(input.scheduledDeliveryDate(), this::setScheduledDeliveryDate)
                .field(input.actualDeliveryDate(), this::setActualDeliveryDate)
                .field(input.engravingName(), this::setEngravingName)
                .field(input.engravingDate(), this::setEngravingDate)
                .field(input.fontStyle(), this::setFontStyle)
                .field(input.note(), this::setNote);
    }

    /**
     * Ledger key this reservation counts towards, or {@code null} if it counts towards none.
     */
    public IncentiveKey incentiveKey() {
        return IncentiveKey.of(staffInCharge, date);
    }

    public PaymentStatus advancePaymentStatus() {
        paymentStatus = paymentStatus == null ? PaymentStatus.UNPAID.next() : paymentStatus.next();
        return paymentStatus;
    }

    public DeliveryStatus advanceDeliveryStatus() {
        deliveryStatus = deliveryStatus == null ? DeliveryStatus.PENDING.next() : deliveryStatus.next();
        return deliveryStatus;
    }

    public ReservationStatus toggleReservationStatus() {
        reservationStatus = reservationStatus == null ? ReservationStatus.STANDBY.next() : reservationStatus.next();
        return reservationStatus;
    }

    public boolean hasLegacyPersonalInfo() {
        return legacyPersonalInfo != null && !legacyPersonalInfo.isEmpty();
    }

    public void stripLegacyPersonalInfo() {
        legacyPersonalInfo = null;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (paymentStatus == null) {
            paymentStatus = PaymentStatus.UNPAID;
        }
        if (reservationStatus == null) {
            reservationStatus = ReservationStatus.STANDBY;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum DeliveryMethod {
        @JsonProperty("studio") STUDIO,
        @JsonProperty("shipping") SHIPPING
    }

    public enum FontStyle {
        @JsonProperty("mincho") MINCHO,
        @JsonProperty("gothic") GOTHIC,
        @JsonProperty("cursive") CURSIVE
    }
}
