package org.neuralchilli.flotilla.scheduler;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.flotilla.config.TimeoutDefaults;
import org.neuralchilli.flotilla.core.LifecycleStateMachine;
import org.neuralchilli.flotilla.core.WorkflowStore;
import org.neuralchilli.flotilla.domain.WorkflowRecord;
import org.neuralchilli.flotilla.domain.WorkflowStatus;
import org.neuralchilli.flotilla.gang.GangCoordinator;
import org.neuralchilli.flotilla.gang.StartBarrier;
import org.neuralchilli.flotilla.monitoring.SchedulingMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background sweep over time-based rules:
 * - queue timeout: a workflow still PENDING after its queue timeout
 * - exec timeout: a started workflow running longer than its exec timeout
 * - start timeout: a start barrier that was not released in time
 * - backoff: replacement tasks whose backoff has elapsed are placed
 * - retention: workflows finished longer ago than the history retention are evicted
 * Each sweep also re-runs admission for every pool with queued groups.
 * <p>
 * Not started in test mode; tests call {@link #sweep(Instant)} directly.
 */
@ApplicationScoped
public class DeadlineMonitor {

    private static final Logger log = LoggerFactory.getLogger(DeadlineMonitor.class);

    static final String SYSTEM_USER = "system";

    @Inject
    WorkflowStore store;

    @Inject
    LifecycleStateMachine lifecycle;

    @Inject
    AdmissionScheduler scheduler;

    @Inject
    GangCoordinator gang;

    @Inject
    SchedulingMonitor monitor;

    @Inject
    TimeoutDefaults timeouts;

    @ConfigProperty(name = "orchestrator.deadline.sweep-interval", defaultValue = "PT5S")
    Duration sweepInterval;

    @ConfigProperty(name = "orchestrator.history.retention", defaultValue = "P30D")
    Duration retention;

    @ConfigProperty(name = "orchestrator.test-mode", defaultValue = "false")
    boolean testMode;

    private ScheduledExecutorService executor;

    void onStart(@Observes StartupEvent event) {
        if (testMode) {
            log.info("Test mode: deadline sweeps are driven by tests");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "deadline-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = sweepInterval.toMillis();
        executor.scheduleAtFixedRate(this::safeSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Deadline monitor scheduled every {}ms", intervalMs);
    }

    void onStop(@Observes ShutdownEvent event) {
        if (executor != null) {
            executor.shutdownNow();
            log.info("Deadline monitor stopped");
        }
        monitor.logSummary();
    }

    /**
     * Apply every time-based rule as of {@code now}.
     *
     * @return number of workflows or groups that timed out
     */
    public int sweep(Instant now) {
        int expired = 0;

        for (WorkflowRecord workflow : store.unfinishedWorkflows()) {
            if (isQueueTimedOut(workflow, now)) {
                log.warn("Workflow {} ({}) exceeded its queue timeout of {}",
                        workflow.name(), workflow.id(), queueTimeout(workflow));
                if (lifecycle.cancel(workflow.id(), SYSTEM_USER, WorkflowStatus.FAILED_QUEUE_TIMEOUT)) {
                    monitor.recordQueueTimeout();
                    expired++;
                }
            } else if (isExecTimedOut(workflow, now)) {
                log.warn("Workflow {} ({}) exceeded its exec timeout of {}",
                        workflow.name(), workflow.id(), execTimeout(workflow));
                if (lifecycle.cancel(workflow.id(), SYSTEM_USER, WorkflowStatus.FAILED_EXEC_TIMEOUT)) {
                    monitor.recordExecTimeout();
                    expired++;
                }
            }
        }

        for (StartBarrier barrier : gang.expiredBarriers(now)) {
            lifecycle.failStartTimeout(barrier.group());
            expired++;
        }

        lifecycle.placeDueReplacements(now);
        scheduler.requestAdmissionAll();
        evictFinished(now);
        return expired;
    }

    private void evictFinished(Instant now) {
        int evicted = 0;
        for (UUID workflowId : store.finishedBefore(now.minus(retention))) {
            if (lifecycle.evict(workflowId)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} workflow(s) finished more than {} ago", evicted, retention);
        }
    }

    private void safeSweep() {
        try {
            int expired = sweep(Instant.now());
            if (expired > 0) {
                log.info("Deadline sweep expired {} workflow(s)/group(s)", expired);
            }
        } catch (Exception e) {
            log.error("Error in deadline sweep", e);
        }
    }

    private boolean isQueueTimedOut(WorkflowRecord workflow, Instant now) {
        return workflow.status() == WorkflowStatus.PENDING
                && workflow.submittedAt().plus(queueTimeout(workflow)).isBefore(now);
    }

    private boolean isExecTimedOut(WorkflowRecord workflow, Instant now) {
        return workflow.hasStarted()
                && workflow.startedAt().plus(execTimeout(workflow)).isBefore(now);
    }

    private Duration queueTimeout(WorkflowRecord workflow) {
        return workflow.queueTimeout() != null ? workflow.queueTimeout() : timeouts.queue();
    }

    private Duration execTimeout(WorkflowRecord workflow) {
        return workflow.execTimeout() != null ? workflow.execTimeout() : timeouts.exec();
    }
}
