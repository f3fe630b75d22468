package com.moldstudio.reservation.api.dto;

import java.time.LocalDate;

/**
 * One ledger key whose stored count differed from the count derived from reservations.
 * A count of 0 means "no entry".
 */
public record LedgerCorrection(
        String staffInCharge,
        LocalDate date,
        int previousCount,
        int recomputedCount
) {
}
