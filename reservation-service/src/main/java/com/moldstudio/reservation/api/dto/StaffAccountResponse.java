package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.StaffAccount;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Account view; the password hash is never exposed.
 */
public record StaffAccountResponse(
        String id,
        String username,
        String name,
        StaffAccount.Role role,
        BigDecimal incentiveRate,
        boolean requirePasswordChange,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static StaffAccountResponse from(StaffAccount account) {
        return new StaffAccountResponse(
                account.getId(),
                account.getUsername(),
                account.getName(),
                account.getRole(),
                account.getIncentiveRate(),
                account.isRequirePasswordChange(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }
}
