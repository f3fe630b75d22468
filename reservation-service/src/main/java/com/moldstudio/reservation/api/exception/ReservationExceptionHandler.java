package com.moldstudio.reservation.api.exception;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.ReservationResponse;
import com.moldstudio.reservation.exception.LedgerInconsistencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * When the reservation was written but its ledger adjustment failed:
 * return 202 Accepted with the reservation so the client does not show "failed".
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ReservationExceptionHandler {

    public static final String LEDGER_INCONSISTENCY = "LEDGER_INCONSISTENCY";

    @ExceptionHandler(LedgerInconsistencyException.class)
    public ResponseEntity<BaseResponse<ReservationResponse>> handleLedgerInconsistency(
            LedgerInconsistencyException ex) {
        log.warn("Reservation {} saved with ledger inconsistency: {}",
                ex.getReservation() != null ? ex.getReservation().id() : null, ex.getMessage());
        BaseResponse<ReservationResponse> response = BaseResponse.degraded(
                "Reservation saved, but the incentive ledger could not be updated. Run an incentive rebuild.",
                LEDGER_INCONSISTENCY,
                ex.getReservation());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
