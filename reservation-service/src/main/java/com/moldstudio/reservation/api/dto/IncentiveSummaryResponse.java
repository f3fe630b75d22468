package com.moldstudio.reservation.api.dto;

/**
 * Monthly total of one staff member.
 */
public record IncentiveSummaryResponse(
        String month,
        String staffInCharge,
        long count,
        long amount
) {
}
