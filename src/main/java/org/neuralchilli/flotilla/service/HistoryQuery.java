package org.neuralchilli.flotilla.service;

import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.neuralchilli.flotilla.domain.WorkflowStatus;

import java.time.Instant;
import java.util.Set;

/**
 * Filter for workflow history. Null fields match everything.
 *
 * @param limit maximum number of entries, newest first
 */
public record HistoryQuery(
        String user,
        String pool,
        Set<WorkflowStatus> statuses,
        Instant submittedAfter,
        int limit
) {

    public static final int DEFAULT_LIMIT = 100;

    public HistoryQuery {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }

    public static HistoryQuery all() {
        return new HistoryQuery(null, null, Set.of(), null, DEFAULT_LIMIT);
    }

    public boolean matches(WorkflowRecord workflow) {
        if (user != null && !user.equals(workflow.user())) {
            return false;
        }
        if (pool != null && !pool.equals(workflow.pool())) {
            return false;
        }
        if (!statuses.isEmpty() && !statuses.contains(workflow.status())) {
            return false;
        }
        return submittedAfter == null || workflow.submittedAt().isAfter(submittedAfter);
    }
}
