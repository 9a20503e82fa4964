package org.neuralchilli.flotilla.domain;

/**
 * Operational status of a pool. Only ONLINE pools admit work.
 */
public enum PoolStatus {
    ONLINE,
    OFFLINE,
    MAINTENANCE;

    public static PoolStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return ONLINE;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
