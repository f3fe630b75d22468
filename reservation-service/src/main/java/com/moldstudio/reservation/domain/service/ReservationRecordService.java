package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.InvalidInputException;
import com.moldstudio.common.exception.ResourceNotFoundException;
import com.moldstudio.common.util.Constants;
import com.moldstudio.common.util.IdGenerator;
import com.moldstudio.reservation.domain.model.Customer;
import com.moldstudio.reservation.domain.model.CustomerFields;
import com.moldstudio.reservation.domain.model.IncentiveKey;
import com.moldstudio.reservation.domain.model.Reservation;
import com.moldstudio.reservation.domain.model.ReservationInput;
import com.moldstudio.reservation.domain.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.function.Consumer;

/**
 * Primary reservation writes. Each method is one transaction covering the reservation row
 * and the customer upsert; the incentive ledger is adjusted afterwards by
 * {@link ReservationLifecycleService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationRecordService {

    private static final int DEFAULT_MOLD_COUNT = 1;

    private final ReservationRepository reservationRepository;
    private final CustomerRegistryService customerRegistry;

    /**
     * Validates the input, upserts the customer and inserts the reservation.
     * Two creates racing on the first insert of one new customerId are retried.
     */
    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public ReservationWrite create(ReservationInput input, String createdBy) {
        if (input.date() == null) {
            throw new InvalidInputException("date is required");
        }
        validateCounts(input);

        String customerId = StringUtils.hasText(input.customerId())
                ? input.customerId().trim()
                : IdGenerator.newId(Constants.CUSTOMER_ID_PREFIX);
        boolean identityKnown = input.customer().hasIdentity()
                || customerRegistry.find(customerId).map(Customer::hasIdentity).orElse(false);
        if (!identityKnown) {
            throw new InvalidInputException("parentName or childName is required");
        }

        Customer customer = customerRegistry.upsert(customerId, input.customer());

        Reservation reservation = new Reservation();
        reservation.merge(input);
        reservation.setId(IdGenerator.newId(Constants.RESERVATION_ID_PREFIX));
        reservation.setCustomerId(customerId);
        reservation.setCreatedBy(createdBy);
        if (reservation.getMoldCount() == null) {
            reservation.setMoldCount(DEFAULT_MOLD_COUNT);
        }
        Reservation saved = reservationRepository.saveAndFlush(reservation);

        log.info("Created reservation {} on {} for customer {} (staff: {})",
                saved.getId(), saved.getDate(), customerId, saved.getStaffInCharge());
        return new ReservationWrite(saved, customer, null, saved.incentiveKey());
    }

    /**
     * Merges {@code input} into the stored reservation field by field and merges any
     * personal fields into the referenced customer.
     */
    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2))
    @Transactional
    public ReservationWrite update(String id, ReservationInput input) {
        Reservation reservation = load(id);
        validateCounts(input);
        IncentiveKey before = reservation.incentiveKey();

        reservation.merge(input);

        Customer customer;
        if (!input.customer().isEmpty()) {
            customer = mergeCustomer(reservation, input.customer());
        } else {
            customer = customerRegistry.find(reservation.getCustomerId()).orElse(null);
        }

        Reservation saved = reservationRepository.saveAndFlush(reservation);
        log.info("Updated reservation {}", id);
        return new ReservationWrite(saved, customer, before, saved.incentiveKey());
    }

    /**
     * Applies one status step. Status changes never move the reservation's ledger key.
     */
    @Transactional
    public ReservationWrite changeStatus(String id, Consumer<Reservation> step) {
        Reservation reservation = load(id);
        step.accept(reservation);
        Reservation saved = reservationRepository.saveAndFlush(reservation);
        Customer customer = customerRegistry.find(saved.getCustomerId()).orElse(null);
        return new ReservationWrite(saved, customer, saved.incentiveKey(), saved.incentiveKey());
    }

    @Transactional(readOnly = true)
    public ReservationWrite get(String id) {
        Reservation reservation = load(id);
        Customer customer = customerRegistry.find(reservation.getCustomerId()).orElse(null);
        return new ReservationWrite(reservation, customer, reservation.incentiveKey(), reservation.incentiveKey());
    }

    @Transactional
    public void delete(String id) {
        Reservation reservation = load(id);
        reservationRepository.delete(reservation);
        reservationRepository.flush();
        log.info("Deleted reservation {}", id);
    }

    /**
     * Merges {@code fields} into the reservation's customer. When no record exists yet, the new one
     * starts from the reservation's inline legacy fields, which are then cleared.
     */
    private Customer mergeCustomer(Reservation reservation, CustomerFields fields) {
        if (customerRegistry.find(reservation.getCustomerId()).isPresent()) {
            return customerRegistry.upsert(reservation.getCustomerId(), fields);
        }

        CustomerFields seed = reservation.hasLegacyPersonalInfo()
                ? reservation.getLegacyPersonalInfo().toCustomerFields().overlay(fields)
                : fields;
        if (!seed.hasIdentity()) {
            throw new InvalidInputException("parentName or childName is required");
        }
        if (!StringUtils.hasText(reservation.getCustomerId())) {
            reservation.setCustomerId(IdGenerator.newId(Constants.CUSTOMER_ID_PREFIX));
        }
        Customer created = customerRegistry.upsert(reservation.getCustomerId(), seed);
        if (reservation.hasLegacyPersonalInfo()) {
            log.info("Moved inline personal fields of reservation {} into customer {}",
                    reservation.getId(), reservation.getCustomerId());
            reservation.stripLegacyPersonalInfo();
        }
        return created;
    }

    private Reservation load(String id) {
        return reservationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", id));
    }

    private void validateCounts(ReservationInput input) {
        if (input.moldCount() != null && input.moldCount() <= 0) {
            throw new InvalidInputException("moldCount must be a positive integer");
        }
        if (input.duration() != null && input.duration() <= 0) {
            throw new InvalidInputException("duration must be positive");
        }
    }
}
