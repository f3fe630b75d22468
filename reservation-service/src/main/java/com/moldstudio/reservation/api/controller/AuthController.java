package com.moldstudio.reservation.api.controller;

import com.moldstudio.common.dto.BaseResponse;
import com.moldstudio.reservation.api.dto.LoginRequest;
import com.moldstudio.reservation.api.dto.LoginResponse;
import com.moldstudio.reservation.api.dto.SetupResponse;
import com.moldstudio.reservation.api.dto.StaffAccountResponse;
import com.moldstudio.reservation.auth.AuthenticatedStaff;
import com.moldstudio.reservation.domain.service.AuthService;
import com.moldstudio.reservation.domain.service.SetupService;
import com.moldstudio.reservation.domain.service.StaffAccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final StaffAccountService staffAccountService;
    private final SetupService setupService;

    @PostMapping("/auth/login")
    public ResponseEntity<BaseResponse<LoginResponse>> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Login successful", authService.login(request)));
    }

    @GetMapping("/auth/me")
    public ResponseEntity<BaseResponse<StaffAccountResponse>> me(@AuthenticationPrincipal AuthenticatedStaff caller) {
        return ResponseEntity.ok(BaseResponse.success(staffAccountService.get(caller.userId())));
    }

    /**
     * Idempotent first-run bootstrap; public because no account exists yet.
     */
    @PostMapping("/setup")
    public ResponseEntity<BaseResponse<SetupResponse>> setup() {
        SetupResponse response = setupService.setup();
        String message = response.skipped() ? "Setup already completed" : "Setup completed";
        return ResponseEntity.ok(BaseResponse.success(message, response));
    }
}
