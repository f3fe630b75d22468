package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.MigrationReport;
import com.moldstudio.reservation.domain.service.MigrationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/migrate")
@RequiredArgsConstructor
public class MigrationController {

    private final MigrationService migrationService;

    /**
     * Moves inline personal fields of legacy reservations into the customer registry. Safe to re-run.
     */
    @PostMapping("/customers")
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<MigrationReport>> migrateCustomers() {
        MigrationReport report = migrationService.migrateCustomers();
        return ResponseEntity.ok(BaseResponse.success("Customer migration completed", report));
    }
}
