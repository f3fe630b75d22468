package com.moldstudio.reservation.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MasterDataRequest(
        @Size(max = 64) String id,
        @NotBlank @Size(max = 100) String name
) {
}
