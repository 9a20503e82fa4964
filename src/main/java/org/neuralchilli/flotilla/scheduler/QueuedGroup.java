package org.neuralchilli.flotilla.scheduler;

import org.neuralchilli.flotilla.domain.Capacity;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.Priority;

import java.time.Instant;
import java.util.Comparator;

/**
 * A ready group waiting in its pool's admission queue.
 */
public record QueuedGroup(
        GroupKey key,
        String pool,
        Priority priority,
        Instant submittedAt,
        long sequence,
        Capacity demand
) {

    /**
     * Priority first (HIGH before LOW), then submission time, then submission sequence.
     * The group key only separates groups of the same workflow.
     */
    public static final Comparator<QueuedGroup> ADMISSION_ORDER = Comparator
            .comparing(QueuedGroup::priority)
            .thenComparing(QueuedGroup::submittedAt)
            .thenComparingLong(QueuedGroup::sequence)
            .thenComparing(group -> group.key().groupName());

    public QueuedGroup {
        if (key == null) {
            throw new IllegalArgumentException("Group key cannot be null");
        }
        if (pool == null || pool.isBlank()) {
            throw new IllegalArgumentException("Pool cannot be null or empty");
        }
        if (priority == null) {
            throw new IllegalArgumentException("Priority cannot be null");
        }
        if (submittedAt == null) {
            throw new IllegalArgumentException("Submitted at cannot be null");
        }
        if (demand == null) {
            demand = Capacity.ZERO;
        }
    }
}
