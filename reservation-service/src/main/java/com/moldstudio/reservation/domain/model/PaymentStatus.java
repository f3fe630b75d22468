package com.moldstudio.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payment axis: {@code paid -> unpaid -> pending -> paid}.
 */
public enum PaymentStatus implements CyclicStatus<PaymentStatus> {
    @JsonProperty("paid") PAID,
    @JsonProperty("unpaid") UNPAID,
    @JsonProperty("pending") PENDING;

    @Override
    public PaymentStatus next() {
        return switch (this) {
            case PAID -> UNPAID;
            case UNPAID -> PENDING;
            case PENDING -> PAID;
        };
    }
}
