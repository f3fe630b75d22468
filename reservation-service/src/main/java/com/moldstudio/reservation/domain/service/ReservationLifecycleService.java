package com.moldstudio.reservation.domain.service;

import com.moldstudio.reservation.api.dto.ReservationResponse;
import com.moldstudio.reservation.domain.model.Customer;
import com.moldstudio.reservation.domain.model.IncentiveKey;
import com.moldstudio.reservation.domain.model.Reservation;
import com.moldstudio.reservation.domain.model.ReservationInput;
import com.moldstudio.reservation.domain.repository.ReservationRepository;
import com.moldstudio.reservation.exception.LedgerInconsistencyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reservation lifecycle: keeps the customer registry and the incentive ledger consistent
 * with every reservation write.
 *
 * Flow for each write:
 * 1. Primary write (reservation row + customer upsert) in one transaction
 * 2. Ledger adjustment for the affected (staff, date) keys
 *
 * The reservation is the source of truth. If step 2 fails after step 1 committed, the
 * caller gets {@link LedgerInconsistencyException} carrying the saved reservation, and the
 * ledger can be recomputed with {@link IncentiveLedgerService#rebuild()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationLifecycleService {

    private final ReservationRecordService reservationRecords;
    private final IncentiveLedgerService incentiveLedger;
    private final CustomerRegistryService customerRegistry;
    private final ReservationRepository reservationRepository;

    public ReservationResponse create(ReservationInput input, String createdBy) {
        ReservationWrite write = reservationRecords.create(input, createdBy);
        ReservationResponse response = toResponse(write);

        IncentiveKey key = write.keyAfter();
        if (key != null) {
            try {
                incentiveLedger.adjust(key, 1);
            } catch (RuntimeException e) {
                throw ledgerFailure(response, "increment " + key, e);
            }
        }
        return response;
    }

    /**
     * Field-by-field merge. A change of staff or date moves one ledger unit from the old key
     * to the new key as a single step.
     */
    public ReservationResponse update(String id, ReservationInput input) {
        ReservationWrite write = reservationRecords.update(id, input);
        ReservationResponse response = toResponse(write);

        if (!Objects.equals(write.keyBefore(), write.keyAfter())) {
            try {
                incentiveLedger.move(write.keyBefore(), write.keyAfter());
            } catch (RuntimeException e) {
                throw ledgerFailure(response, "move " + write.keyBefore() + " -> " + write.keyAfter(), e);
            }
        }
        return response;
    }

    /**
     * Decrements the ledger, then removes the reservation. If the removal fails the
     * decrement is compensated and the removal failure is rethrown. The customer is kept.
     */
    public ReservationResponse delete(String id) {
        ReservationWrite existing = reservationRecords.get(id);
        ReservationResponse response = toResponse(existing);
        IncentiveKey key = existing.keyAfter();

        RuntimeException ledgerError = null;
        if (key != null) {
            try {
                incentiveLedger.adjust(key, -1);
            } catch (RuntimeException e) {
                ledgerError = e;
            }
        }

        try {
            reservationRecords.delete(id);
        } catch (RuntimeException e) {
            if (key != null && ledgerError == null) {
                compensateDecrement(id, key, e);
            }
            throw e;
        }

        if (ledgerError != null) {
            throw ledgerFailure(response, "decrement " + key, ledgerError);
        }
        return response;
    }

    public ReservationResponse advancePaymentStatus(String id) {
        ReservationWrite write = reservationRecords.changeStatus(id, Reservation::advancePaymentStatus);
        log.info("Reservation {} payment status -> {}", id, write.reservation().getPaymentStatus());
        return toResponse(write);
    }

    public ReservationResponse advanceDeliveryStatus(String id) {
        ReservationWrite write = reservationRecords.changeStatus(id, Reservation::advanceDeliveryStatus);
        log.info("Reservation {} delivery status -> {}", id, write.reservation().getDeliveryStatus());
        return toResponse(write);
    }

    public ReservationResponse toggleReservationStatus(String id) {
        ReservationWrite write = reservationRecords.changeStatus(id, Reservation::toggleReservationStatus);
        log.info("Reservation {} reservation status -> {}", id, write.reservation().getReservationStatus());
        return toResponse(write);
    }

    public ReservationResponse get(String id) {
        return toResponse(reservationRecords.get(id));
    }

    /**
     * Reservations ordered by date then time slot; every criterion is optional and
     * the date range is inclusive.
     */
    @Transactional(readOnly = true)
    public List<ReservationResponse> list(LocalDate from, LocalDate to, String staff, String customer) {
        List<Reservation> reservations = reservationRepository.search(
                from, to, StringUtils.hasText(staff) ? staff.trim() : null,
                StringUtils.hasText(customer) ? customer.trim() : null);
        return join(reservations);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> listByCustomer(String customerId) {
        customerRegistry.get(customerId);
        return join(reservationRepository.findByCustomerIdOrderByDateAscTimeSlotAsc(customerId));
    }

    private List<ReservationResponse> join(List<Reservation> reservations) {
        Set<String> customerIds = reservations.stream()
                .map(Reservation::getCustomerId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<String, Customer> customers = customerRegistry.findAllById(customerIds);
        return reservations.stream()
                .map(reservation -> ReservationResponse.from(reservation, customers.get(reservation.getCustomerId())))
                .toList();
    }

    private ReservationResponse toResponse(ReservationWrite write) {
        return ReservationResponse.from(write.reservation(), write.customer());
    }

    private void compensateDecrement(String id, IncentiveKey key, RuntimeException deleteError) {
        try {
            incentiveLedger.adjust(key, 1);
            log.warn("Delete of reservation {} failed, ledger decrement of {} compensated", id, key);
        } catch (RuntimeException compensationError) {
            log.error("Delete of reservation {} failed and ledger decrement of {} could not be compensated",
                    id, key, compensationError);
            deleteError.addSuppressed(compensationError);
        }
    }

    private LedgerInconsistencyException ledgerFailure(ReservationResponse response, String operation,
                                                        RuntimeException cause) {
        log.warn("Ledger {} failed for reservation {}: {}", operation, response.id(), cause.getMessage(), cause);
        return new LedgerInconsistencyException(response,
                "Incentive ledger " + operation + " failed for reservation " + response.id(), cause);
    }
}
