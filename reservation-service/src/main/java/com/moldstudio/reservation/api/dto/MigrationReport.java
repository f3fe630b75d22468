package com.moldstudio.reservation.api.dto;

import java.util.List;

public record MigrationReport(
        long scanned,
        int customersMigrated,
        int reservationsUpdated,
        List<RecordError> errors
) {
    public record RecordError(String reservationId, String error) {
    }
}
