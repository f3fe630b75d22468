package com.moldstudio.reservation.api.dto;

public record LoginResponse(
        String token,
        StaffAccountResponse user
) {
}
