package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.StaffAccount;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Partial account update. {@code currentPassword} is required when users change their own password.
 */
public record UpdateStaffAccountRequest(
        @Size(max = 100) String name,
        String currentPassword,
        String newPassword,
        StaffAccount.Role role,
        @DecimalMin("0") BigDecimal incentiveRate
) {
}
