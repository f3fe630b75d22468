package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.IncentiveEntry;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record IncentiveEntryResponse(
        String staffInCharge,
        LocalDate date,
        int count,
        long amount,
        LocalDateTime updatedAt
) {
    public static IncentiveEntryResponse from(IncentiveEntry entry) {
        return new IncentiveEntryResponse(
                entry.getStaffInCharge(),
                entry.getEntryDate(),
                entry.getReservationCount(),
                entry.getAmount(),
                entry.getUpdatedAt()
        );
    }
}
