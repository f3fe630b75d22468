package com.moldstudio.reservation.api.dto;

import com.moldstudio.reservation.domain.model.Location;
import com.moldstudio.reservation.domain.model.StaffMember;

import java.time.LocalDateTime;

public record MasterDataResponse(
        String id,
        String name,
        LocalDateTime createdAt
) {
    public static MasterDataResponse from(StaffMember staffMember) {
        return new MasterDataResponse(staffMember.getId(), staffMember.getName(), staffMember.getCreatedAt());
    }

    public static MasterDataResponse from(Location location) {
        return new MasterDataResponse(location.getId(), location.getName(), location.getCreatedAt());
    }
}
