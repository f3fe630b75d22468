package com.moldstudio.reservation.domain.service;

import com.moldstudio.reservation.api.dto.MigrationReport;
import com.moldstudio.reservation.domain.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot normalisation of legacy reservations into the customer registry.
 * Safe to re-run: migrated reservations no longer carry inline fields and existing
 * customers are never overwritten. Intended for a maintenance window without
 * concurrent reservation writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationService {

    private final ReservationRepository reservationRepository;
    private final LegacyReservationMigrator migrator;

    public MigrationReport migrateCustomers() {
        long scanned = reservationRepository.count();
        List<String> candidates = reservationRepository.findIdsWithLegacyPersonalInfo();
        log.info("Customer migration started: {} reservations, {} with inline personal fields",
                scanned, candidates.size());

        int customersMigrated = 0;
        int reservationsUpdated = 0;
        List<MigrationReport.RecordError> errors = new ArrayList<>();

        for (String reservationId : candidates) {
            try {
                if (migrator.migrate(reservationId)) {
                    customersMigrated++;
                }
                reservationsUpdated++;
            } catch (RuntimeException e) {
                log.warn("Customer migration failed for reservation {}: {}", reservationId, e.getMessage());
                errors.add(new MigrationReport.RecordError(reservationId, e.getMessage()));
            }
        }

        log.info("Customer migration finished: {} customers created, {} reservations updated, {} errors",
                customersMigrated, reservationsUpdated, errors.size());
        return new MigrationReport(scanned, customersMigrated, reservationsUpdated, errors);
    }
}
