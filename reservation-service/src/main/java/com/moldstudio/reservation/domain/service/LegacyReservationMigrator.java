package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.InvalidInputException;
import com.moldstudio.common.exception.ResourceNotFoundException;
import com.moldstudio.common.util.Constants;
import com.moldstudio.common.util.IdGenerator;
import com.moldstudio.reservation.domain.model.LegacyPersonalInfo;
import com.moldstudio.reservation.domain.model.Reservation;
import com.moldstudio.reservation.domain.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Migrates one legacy reservation in its own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LegacyReservationMigrator {

    private final ReservationRepository reservationRepository;
    private final CustomerRegistryService customerRegistry;

    /**
     * Moves the inline personal fields of one reservation into the customer registry
     * (only if the customer does not exist yet) and clears them from the reservation.
     *
     * @return true if a customer record was created
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean migrate(String reservationId) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

        boolean customerCreated = false;
        if (reservation.hasLegacyPersonalInfo()) {
            LegacyPersonalInfo legacy = reservation.getLegacyPersonalInfo();
            String customerId = reservation.getCustomerId();
            if (!StringUtils.hasText(customerId)) {
                if (!legacy.hasIdentity()) {
                    throw new InvalidInputException("Reservation has neither a customerId nor a parent/child name");
                }
                customerId = IdGenerator.newId(Constants.CUSTOMER_ID_PREFIX);
                reservation.setCustomerId(customerId);
            }
            customerCreated = customerRegistry.createIfAbsent(customerId, legacy.toCustomerFields());
            log.debug("Reservation {} linked to customer {} (created: {})", reservationId, customerId, customerCreated);
        }

        reservation.stripLegacyPersonalInfo();
        reservationRepository.saveAndFlush(reservation);
        return customerCreated;
    }
}
