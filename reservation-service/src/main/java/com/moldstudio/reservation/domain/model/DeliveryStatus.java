package com.moldstudio.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Production/delivery axis: {@code pending -> shipped -> completed -> pending}.
 */
public enum DeliveryStatus implements CyclicStatus<DeliveryStatus> {
    @JsonProperty("pending") PENDING,
    @JsonProperty("shipped") SHIPPED,
    @JsonProperty("completed") COMPLETED;

    @Override
    public DeliveryStatus next() {
        return switch (this) {
            case PENDING -> SHIPPED;
            case SHIPPED -> COMPLETED;
            case COMPLETED -> PENDING;
        };
    }
}
