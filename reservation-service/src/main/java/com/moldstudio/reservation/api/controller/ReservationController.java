package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.ReservationRequest;
import com.moldstudio.reservation.api.dto.ReservationResponse;
import com.moldstudio.reservation.auth.AuthenticatedStaff;
import com.moldstudio.reservation.domain.service.ReservationLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for reservations. Writes keep the customer registry and the
 * incentive ledger consistent; a ledger failure after a successful write is
 * answered with 202 Accepted.
 */
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationLifecycleService lifecycleService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<ReservationResponse>>> listReservations(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) String staffInCharge,
            @RequestParam(required = false) String customerId) {
        List<ReservationResponse> response = lifecycleService.list(from, to, staffInCharge, customerId);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> getReservation(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.get(id)));
    }

    @PostMapping
    public ResponseEntity<BaseResponse<ReservationResponse>> createReservation(
            @Valid @RequestBody ReservationRequest request,
            @AuthenticationPrincipal AuthenticatedStaff caller) {
        ReservationResponse response = lifecycleService.create(request.toInput(), caller.username());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Reservation created successfully", response));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> updateReservation(
            @PathVariable String id,
            @Valid @RequestBody ReservationRequest request) {
        ReservationResponse response = lifecycleService.update(id, request.toInput());
        return ResponseEntity.ok(BaseResponse.success("Reservation updated successfully", response));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> deleteReservation(@PathVariable String id) {
        ReservationResponse response = lifecycleService.delete(id);
        return ResponseEntity.ok(BaseResponse.success("Reservation deleted successfully", response));
    }

    /**
     * paid -> unpaid -> pending -> paid
     */
    @PatchMapping("/{id}/payment-status")
    public ResponseEntity<BaseResponse<ReservationResponse>> advancePaymentStatus(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.advancePaymentStatus(id)));
    }

    /**
     * pending -> shipped -> completed -> pending
     */
    @PatchMapping("/{id}/delivery-status")
    public ResponseEntity<BaseResponse<ReservationResponse>> advanceDeliveryStatus(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.advanceDeliveryStatus(id)));
    }

    /**
     * standby <-> confirmed
     */
    @PatchMapping("/{id}/reservation-status")
    public ResponseEntity<BaseResponse<ReservationResponse>> toggleReservationStatus(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.toggleReservationStatus(id)));
    }
}
