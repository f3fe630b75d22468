package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.CreateStaffAccountRequest;
import com.moldstudio.reservation.api.dto.StaffAccountResponse;
import com.moldstudio.reservation.api.dto.UpdateStaffAccountRequest;
import com.moldstudio.reservation.auth.AuthenticatedStaff;
import com.moldstudio.reservation.domain.service.StaffAccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class StaffAccountController {

    private final StaffAccountService staffAccountService;

    @GetMapping
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<List<StaffAccountResponse>>> listAccounts() {
        return ResponseEntity.ok(BaseResponse.success(staffAccountService.list()));
    }

    @PostMapping
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<StaffAccountResponse>> createAccount(
            @Valid @RequestBody CreateStaffAccountRequest request) {
        StaffAccountResponse response = staffAccountService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("User created successfully", response));
    }

    /**
     * Self or manager; checked in the service.
     */
    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<StaffAccountResponse>> updateAccount(
            @PathVariable String id,
            @Valid @RequestBody UpdateStaffAccountRequest request,
            @AuthenticationPrincipal AuthenticatedStaff caller) {
        StaffAccountResponse response = staffAccountService.update(id, request, caller);
        return ResponseEntity.ok(BaseResponse.success("User updated successfully", response));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('MANAGER')")
    public ResponseEntity<BaseResponse<Void>> deleteAccount(
            @PathVariable String id,
            @AuthenticationPrincipal AuthenticatedStaff caller) {
        staffAccountService.delete(id, caller);
        return ResponseEntity.ok(BaseResponse.success("User deleted successfully", null));
    }
}
