package com.moldstudio.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Confirmation axis: {@code standby <-> confirmed}.
 */
public enum ReservationStatus implements CyclicStatus<ReservationStatus> {
    @JsonProperty("standby") STANDBY,
    @JsonProperty("confirmed") CONFIRMED;

    @Override
    public ReservationStatus next() {
        return this == STANDBY ? CONFIRMED : STANDBY;
    }
}
