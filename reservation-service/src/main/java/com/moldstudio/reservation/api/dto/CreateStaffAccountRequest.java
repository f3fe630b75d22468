package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.StaffAccount;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CreateStaffAccountRequest(
        @NotBlank @Size(max = 64) String username,
        @NotBlank String password,
        @NotBlank @Size(max = 100) String name,
        @NotNull StaffAccount.Role role,
        @DecimalMin("0") BigDecimal incentiveRate
) {
}
