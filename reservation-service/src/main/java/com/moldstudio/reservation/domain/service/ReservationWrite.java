package com.moldstudio.reservation.domain.service;

import com.moldstudio.reservation.domain.model.Customer;
import com.moldstudio.reservation.domain.model.IncentiveKey;
import com.moldstudio.reservation.domain.model.Reservation;

/**
 * Outcome of a committed reservation write: the stored row, its customer (null if dangling)
 * and the ledger key it counted towards before and after the write (null when none).
 */
public record ReservationWrite(
        Reservation reservation,
        Customer customer,
        IncentiveKey keyBefore,
        IncentiveKey keyAfter
) {
}
