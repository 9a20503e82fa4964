package org.neuralchilli.flotilla.domain;

/**
 * Admission priority of a workflow. Immutable after submission.
 * Declaration order is admission order: HIGH is admitted before NORMAL before LOW.
 */
public enum Priority {
    /**
     * Served first from the pool's HIGH quota, never preempted
     */
    HIGH,

    /**
     * Served from the pool's NORMAL quota, never preempted
     */
    NORMAL,

    /**
     * Served from the pool's LOW quota and may borrow idle capacity from sibling pools.
     * Borrowed capacity is revocable.
     */
    LOW;

    /**
     * Only LOW work may run on capacity borrowed from another pool.
     */
    public boolean mayBorrow() {
        return this == LOW;
    }

    /**
     * Parse from YAML, case insensitive. Null means NORMAL.
     */
    public static Priority fromString(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value, e);
        }
    }
}
