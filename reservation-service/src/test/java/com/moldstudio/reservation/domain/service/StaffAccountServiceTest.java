package com.moldstudio.reservation.domain.service;

import com.moldstudio.common.exception.ConflictException;
import com.moldstudio.common.exception.ForbiddenException;
import com.moldstudio.common.exception.InvalidInputException;
import com.moldstudio.reservation.api.dto.CreateStaffAccountRequest;
import com.moldstudio.reservation.api.dto.StaffAccountResponse;
import com.moldstudio.reservation.api.dto.UpdateStaffAccountRequest;
import com.moldstudio.reservation.auth.AuthenticatedStaff;
import com.moldstudio.reservation.domain.model.StaffAccount;
import com.moldstudio.reservation.domain.repository.StaffAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StaffAccountServiceTest {

    private static final AuthenticatedStaff MANAGER = new AuthenticatedStaff("manager", "manager", "manager");
    private static final AuthenticatedStaff SATO = new AuthenticatedStaff("sato", "sato", "staff");

    @Mock
    private StaffAccountRepository staffAccountRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private StaffAccountService staffAccountService;

    @BeforeEach
    void setUp() {
        staffAccountService = new StaffAccountService(staffAccountRepository, passwordEncoder);
        ReflectionTestUtils.setField(staffAccountService, "minPasswordLength", 8);
    }

    private StaffAccount account(String username, String password, StaffAccount.Role role) {
        return StaffAccount.builder()
                .id(username)
                .username(username)
                .passwordHash(passwordEncoder.encode(password))
                .name(username)
                .role(role)
                .requirePasswordChange(true)
                .build();
    }

    @Test
    @DisplayName("create() hashes the password and requires a change on first login")
    void create_hashesPassword() {
        // given
        given(staffAccountRepository.existsByUsername("sato")).willReturn(false);
        given(staffAccountRepository.existsById("sato")).willReturn(false);
        given(staffAccountRepository.save(any(StaffAccount.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        StaffAccountResponse response = staffAccountService.create(
                new CreateStaffAccountRequest("sato", "password123", "佐藤", StaffAccount.Role.STAFF, null));

        // then
        assertThat(response.id()).isEqualTo("sato");
        assertThat(response.requirePasswordChange()).isTrue();
    }

    @Test
    @DisplayName("create() rejects short passwords and duplicate usernames")
    void create_rejectsPolicyViolations() {
        assertThatThrownBy(() -> staffAccountService.create(
                new CreateStaffAccountRequest("sato", "short", "佐藤", StaffAccount.Role.STAFF, null)))
                .isInstanceOf(InvalidInputException.class);

        given(staffAccountRepository.existsByUsername("sato")).willReturn(true);
        assertThatThrownBy(() -> staffAccountService.create(
                new CreateStaffAccountRequest("sato", "password123", "佐藤", StaffAccount.Role.STAFF, null)))
                .isInstanceOf(ConflictException.class);
        verify(staffAccountRepository, never()).save(any());
    }

    @Test
    @DisplayName("staff cannot update another account or change their own role")
    void update_staffRestrictions() {
        assertThatThrownBy(() -> staffAccountService.update("suzuki",
                new UpdateStaffAccountRequest("鈴木", null, null, null, null), SATO))
                .isInstanceOf(ForbiddenException.class);

        assertThatThrownBy(() -> staffAccountService.update("sato",
                new UpdateStaffAccountRequest(null, null, null, StaffAccount.Role.MANAGER, null), SATO))
                .isInstanceOf(ForbiddenException.class);

        assertThatThrownBy(() -> staffAccountService.update("sato",
                new UpdateStaffAccountRequest(null, null, null, null, BigDecimal.ONE), SATO))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("changing one's own password requires the correct current password")
    void update_ownPassword_requiresCurrentPassword() {
        // given
        StaffAccount stored = account("sato", "password123", StaffAccount.Role.STAFF);
        given(staffAccountRepository.findById("sato")).willReturn(Optional.of(stored));

        // when / then
        assertThatThrownBy(() -> staffAccountService.update("sato",
                new UpdateStaffAccountRequest(null, null, "newpassword1", null, null), SATO))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> staffAccountService.update("sato",
                new UpdateStaffAccountRequest(null, "wrong-password", "newpassword1", null, null), SATO))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("successful password change stores the new hash and clears the change flag")
    void update_ownPassword_success() {
        // given
        StaffAccount stored = account("sato", "password123", StaffAccount.Role.STAFF);
        given(staffAccountRepository.findById("sato")).willReturn(Optional.of(stored));
        given(staffAccountRepository.save(any(StaffAccount.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        StaffAccountResponse response = staffAccountService.update("sato",
                new UpdateStaffAccountRequest(null, "password123", "newpassword1", null, null), SATO);

        // then
        assertThat(response.requirePasswordChange()).isFalse();
        assertThat(passwordEncoder.matches("newpassword1", stored.getPasswordHash())).isTrue();
    }

    @Test
    @DisplayName("a manager resets another account's password without the current password")
    void update_managerResetsPassword() {
        // given
        StaffAccount stored = account("sato", "password123", StaffAccount.Role.STAFF);
        given(staffAccountRepository.findById("sato")).willReturn(Optional.of(stored));
        given(staffAccountRepository.save(any(StaffAccount.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        staffAccountService.update("sato",
                new UpdateStaffAccountRequest(null, null, "resetpass99", StaffAccount.Role.MANAGER, null), MANAGER);

        // then
        assertThat(passwordEncoder.matches("resetpass99", stored.getPasswordHash())).isTrue();
        assertThat(stored.getRole()).isEqualTo(StaffAccount.Role.MANAGER);
    }

    @Test
    @DisplayName("a manager cannot delete their own account")
    void delete_self_rejected() {
        assertThatThrownBy(() -> staffAccountService.delete("manager", MANAGER))
                .isInstanceOf(InvalidInputException.class);
        verify(staffAccountRepository, never()).delete(any());
    }
}
