package com.moldstudio.reservation.api.dto;

public record SetupResponse(
        boolean skipped,
        int accountsCreated,
        int locationsCreated,
        int staffMembersCreated
) {
    public static SetupResponse skippedSetup() {
        return new SetupResponse(true, 0, 0, 0);
    }
}
