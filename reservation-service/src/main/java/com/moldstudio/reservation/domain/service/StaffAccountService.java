package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.ConflictException;
import com.moldstudio.common.exception.ForbiddenException;
import com.moldstudio.common.exception.InvalidInputException;
import com.moldstudio.common.exception.ResourceNotFoundException;
import com.moldstudio.reservation.api.dto.CreateStaffAccountRequest;
import com.moldstudio.reservation.api.dto.StaffAccountResponse;
import com.moldstudio.reservation.api.dto.UpdateStaffAccountRequest;
import com.moldstudio.reservation.auth.AuthenticatedStaff;
import com.moldstudio.reservation.domain.model.StaffAccount;
import com.moldstudio.reservation.domain.repository.StaffAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Identity store: staff login accounts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaffAccountService {

    private final StaffAccountRepository staffAccountRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${studio.auth.min-password-length:8}")
    private int minPasswordLength;

    @Transactional(readOnly = true)
    public List<StaffAccountResponse> list() {
        return staffAccountRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(StaffAccountResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public StaffAccountResponse get(String id) {
        return StaffAccountResponse.from(load(id));
    }

    /**
     * New accounts must change their password on first login.
     */
    @Transactional
    public StaffAccountResponse create(CreateStaffAccountRequest request) {
        String username = request.username().trim();
        checkPasswordPolicy(request.password());
        if (staffAccountRepository.existsByUsername(username) || staffAccountRepository.existsById(username)) {
            throw new ConflictException("User", username);
        }

        StaffAccount account = StaffAccount.builder()
                .id(username)
                .username(username)
                .passwordHash(passwordEncoder.encode(request.password()))
                .name(request.name().trim())
                .role(request.role())
                .incentiveRate(request.incentiveRate())
                .requirePasswordChange(true)
                .build();
        StaffAccount saved = staffAccountRepository.save(account);
        log.info("Created {} account {}", saved.getRole().code(), username);
        return StaffAccountResponse.from(saved);
    }

    /**
     * Users may update themselves; managers may update anyone. Only managers change role or
     * incentive rate, and users changing their own password must confirm the current one.
     */
    @Transactional
    public StaffAccountResponse update(String id, UpdateStaffAccountRequest request, AuthenticatedStaff caller) {
        boolean self = caller.userId().equals(id);
        if (!self && !caller.isManager()) {
            throw new ForbiddenException("You can only update your own account");
        }
        if ((request.role() != null || request.incentiveRate() != null) && !caller.isManager()) {
            throw new ForbiddenException("Only a manager can change role or incentive rate");
        }

        StaffAccount account = load(id);

        if (StringUtils.hasText(request.name())) {
            account.setName(request.name().trim());
        }
        if (request.role() != null) {
            account.setRole(request.role());
        }
        if (request.incentiveRate() != null) {
            account.setIncentiveRate(request.incentiveRate());
        }
        if (request.newPassword() != null) {
            checkPasswordPolicy(request.newPassword());
            if (self) {
                if (!StringUtils.hasText(request.currentPassword())) {
                    throw new InvalidInputException("Current password is required");
                }
                if (!passwordEncoder.matches(request.currentPassword(), account.getPasswordHash())) {
                    throw new InvalidInputException("Current password is incorrect");
                }
            }
            account.setPasswordHash(passwordEncoder.encode(request.newPassword()));
            log.info("Password changed for account {} by {}", id, caller.username());
        }
        account.setRequirePasswordChange(false);

        StaffAccount saved = staffAccountRepository.save(account);
        log.info("Updated account {}", id);
        return StaffAccountResponse.from(saved);
    }

    @Transactional
    public void delete(String id, AuthenticatedStaff caller) {
        if (caller.userId().equals(id)) {
            throw new InvalidInputException("You cannot delete your own account");
        }
        StaffAccount account = load(id);
        staffAccountRepository.delete(account);
        log.info("Deleted account {} by {}", id, caller.username());
    }

    private StaffAccount load(String id) {
        return staffAccountRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", id));
    }

    private void checkPasswordPolicy(String password) {
        if (password == null || password.length() < minPasswordLength) {
            throw new InvalidInputException(
                    "Password must be at least " + minPasswordLength + " characters");
        }
    }
}
