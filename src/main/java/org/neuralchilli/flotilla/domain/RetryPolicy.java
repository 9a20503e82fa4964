package org.neuralchilli.flotilla.domain;

/**
 * What the lifecycle does with a task instance that ended in a given status.
 */
public enum RetryPolicy {
    /**
     * Retire the instance and schedule a new one, up to the retry ceiling
     */
    RESCHEDULE,

    /**
     * Like RESCHEDULE, but the new instance waits an exponential backoff first
     */
    BACKOFF,

    /**
     * Never retried automatically
     */
    NEVER,

    /**
     * Left for an operator to decide; never retried automatically
     */
    ADMIN_OVERRIDE;

    public boolean isAutomatic() {
        return this == RESCHEDULE || this == BACKOFF;
    }
}
