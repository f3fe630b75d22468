package com.moldstudio.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reservation state kept on the customer record; {@code none} for customers without a booking.
 */
public enum CustomerReservationStatus {
    @JsonProperty("standby") STANDBY,
    @JsonProperty("confirmed") CONFIRMED,
    @JsonProperty("none") NONE
}
