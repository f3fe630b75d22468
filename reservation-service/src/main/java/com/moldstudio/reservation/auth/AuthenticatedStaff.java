package com.moldstudio.reservation.auth;

import com.moldstudio.common.util.Constants;

/**
 * Principal resolved from a bearer token.
 */
public record AuthenticatedStaff(String userId, String username, String role) {

    public boolean isManager() {
        return Constants.ROLE_MANAGER.equals(role);
    }
}
