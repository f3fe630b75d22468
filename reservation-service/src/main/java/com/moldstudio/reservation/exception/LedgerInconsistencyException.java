package com.moldstudio.reservation.exception;

import com.moldstudio.reservation.api.dto.ReservationResponse;
import lombok.Getter;

/**
 * Thrown when a reservation write succeeded but its incentive ledger adjustment did not.
 * The reservation is the source of truth; the ledger is recomputable via rebuild.
 * API should return 202 Accepted with this reservation rather than an error.
 */
@Getter
public class LedgerInconsistencyException extends RuntimeException {

    private final ReservationResponse reservation;

    public LedgerInconsistencyException(ReservationResponse reservation, String message, Throwable cause) {
        super(message, cause);
        this.reservation = reservation;
    }
}
