package com.moldstudio.reservation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.moldstudio.common.util.Constants;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Login account of a studio employee. The id equals the username.
 */
@Entity
@Table(name = "staff_accounts",
        uniqueConstraints = @UniqueConstraint(name = "uk_staff_accounts_username", columnNames = "username"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffAccount {
    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "username", nullable = false, length = 64)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "display_name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_role", nullable = false, length = 20)
    private Role role;

    @Column(name = "incentive_rate", precision = 5, scale = 2)
    private BigDecimal incentiveRate;

    @Column(name = "require_password_change", nullable = false)
    private boolean requirePasswordChange;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isManager() {
        return role == Role.MANAGER;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum Role {
        @JsonProperty(Constants.ROLE_MANAGER) MANAGER(Constants.ROLE_MANAGER),
        @JsonProperty(Constants.ROLE_STAFF) STAFF(Constants.ROLE_STAFF);

        private final String code;

        Role(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        public static Role fromCode(String code) {
            for (Role role : values()) {
                if (role.code.equalsIgnoreCase(code)) {
                    return role;
                }
            }
            throw new IllegalArgumentException("Unknown role: " + code);
        }
    }
}
