package com.moldstudio.common.util;

/**
 * Common constants used across all modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:incentive:";

    public static final String RESERVATION_ID_PREFIX = "RSV";
    public static final String CUSTOMER_ID_PREFIX = "CUST";
    public static final String MASTER_ID_PREFIX = "M";

    public static final String ROLE_MANAGER = "manager";
    public static final String ROLE_STAFF = "staff";
}
