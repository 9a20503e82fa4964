package org.neuralchilli.flotilla.domain;

/**
 * Outcome assigned to a task by its exit code.
 */
public enum ExitAction {
    COMPLETE,
    FAIL,
    RESCHEDULE;

    public static ExitAction fromString(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
