package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.UnauthorizedException;
import com.moldstudio.reservation.api.dto.LoginRequest;
import com.moldstudio.reservation.api.dto.LoginResponse;
import com.moldstudio.reservation.api.dto.StaffAccountResponse;
import com.moldstudio.reservation.auth.AccessTokenCodec;
import com.moldstudio.reservation.auth.AuthenticatedStaff;
import com.moldstudio.reservation.domain.model.StaffAccount;
import com.moldstudio.reservation.domain.repository.StaffAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final StaffAccountRepository staffAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final AccessTokenCodec tokenCodec;

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        StaffAccount account = staffAccountRepository.findByUsername(request.username().trim())
                .filter(candidate -> passwordEncoder.matches(request.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Failed login for username {}", request.username());
                    return new UnauthorizedException(INVALID_CREDENTIALS);
                });

        String token = tokenCodec.issue(
                new AuthenticatedStaff(account.getId(), account.getUsername(), account.getRole().code()));
        log.info("User {} logged in", account.getUsername());
        return new LoginResponse(token, StaffAccountResponse.from(account));
    }
}
