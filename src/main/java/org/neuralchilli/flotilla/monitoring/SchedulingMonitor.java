package org.neuralchilli.flotilla.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for scheduling decisions.
 *
 * Tracks:
 * - admissions, and how many ran on borrowed capacity
 * - preemptions, reschedules and restarts
 * - gang placement rejections
 * - queue, exec and start timeouts
 * - DAG cache hit rate
 */
@ApplicationScoped
public class SchedulingMonitor {

    private static final Logger log = LoggerFactory.getLogger(SchedulingMonitor.class);

    // Admission metrics
    private final LongAdder admissions = new LongAdder();
    private final LongAdder borrowedAdmissions = new LongAdder();
    private final LongAdder gangRejections = new LongAdder();

    // Reclamation and recovery
    private final LongAdder preemptions = new LongAdder();
    private final LongAdder reschedules = new LongAdder();
    private final LongAdder restarts = new LongAdder();

    // Deadlines
    private final LongAdder queueTimeouts = new LongAdder();
    private final LongAdder execTimeouts = new LongAdder();
    private final LongAdder startTimeouts = new LongAdder();

    // Outcomes
    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();

    // DAG cache
    private final LongAdder dagCacheHits = new LongAdder();
    private final LongAdder dagCacheMisses = new LongAdder();

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordAdmission(boolean borrowed) {
        admissions.increment();
        if (borrowed) {
            borrowedAdmissions.increment();
        }
    }

    public void recordGangRejection() {
        gangRejections.increment();
    }

    public void recordPreemption(int groups) {
        preemptions.add(groups);
    }

    public void recordReschedule() {
        reschedules.increment();
    }

    public void recordRestart() {
        restarts.increment();
    }

    public void recordQueueTimeout() {
        queueTimeouts.increment();
    }

    public void recordExecTimeout() {
        execTimeouts.increment();
    }

    public void recordStartTimeout() {
        startTimeouts.increment();
    }

    public void recordTaskCompleted() {
        tasksCompleted.increment();
    }

    public void recordTaskFailed() {
        tasksFailed.increment();
    }

    public void recordDagCacheHit() {
        dagCacheHits.increment();
    }

    public void recordDagCacheMiss() {
        dagCacheMisses.increment();
    }

    public double getDagCacheHitRate() {
        long hits = dagCacheHits.sum();
        long total = hits + dagCacheMisses.sum();
        return total > 0 ? (hits * 100.0) / total : 0.0;
    }

    public long getPreemptions() {
        return preemptions.sum();
    }

    public long getReschedules() {
        return reschedules.sum();
    }

    public long getAdmissions() {
        return admissions.sum();
    }

    /**
     * Start timing an operation.
     *
     * @param operation Operation name
     * @return Timer handle to stop timing
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    /**
     * Timer handle for operation timing.
     */
    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        public void stop() {
            Duration duration = Duration.between(start, Instant.now());
            timingStats.computeIfAbsent(operation, key -> new TimingStats()).record(duration);
        }
    }

    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    /**
     * Statistics for operation timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(totalNanos.sum() / cnt) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format("TimingStats[count=%d, avg=%dms, max=%dms]",
                    getCount(), getAverage().toMillis(), getMax().toMillis());
        }
    }

    public SchedulingReport getReport() {
        return new SchedulingReport(
                admissions.sum(),
                borrowedAdmissions.sum(),
                gangRejections.sum(),
                preemptions.sum(),
                reschedules.sum(),
                restarts.sum(),
                queueTimeouts.sum(),
                execTimeouts.sum(),
                startTimeouts.sum(),
                tasksCompleted.sum(),
                tasksFailed.sum(),
                getDagCacheHitRate()
        );
    }

    /**
     * Scheduling report snapshot.
     */
    public record SchedulingReport(
            long admissions,
            long borrowedAdmissions,
            long gangRejections,
            long preemptions,
            long reschedules,
            long restarts,
            long queueTimeouts,
            long execTimeouts,
            long startTimeouts,
            long tasksCompleted,
            long tasksFailed,
            double dagCacheHitRate
    ) {
        @Override
        public String toString() {
            return String.format("""
                Scheduling Report:
                ==================
                Admission:
                  Admitted: %d (%d on borrowed capacity)
                  Gang rejections: %d

                Reclamation:
                  Preempted groups: %d
                  Reschedules: %d, Restarts: %d

                Deadlines:
                  Queue: %d, Exec: %d, Start: %d

                Tasks:
                  Completed: %d, Failed: %d

                DAG Cache:
                  Hit Rate: %.1f%%
                """,
                    admissions, borrowedAdmissions, gangRejections,
                    preemptions, reschedules, restarts,
                    queueTimeouts, execTimeouts, startTimeouts,
                    tasksCompleted, tasksFailed,
                    dagCacheHitRate
            );
        }
    }

    public void logSummary() {
        log.info("\n{}", getReport());
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        admissions.reset();
        borrowedAdmissions.reset();
        gangRejections.reset();
        preemptions.reset();
        reschedules.reset();
        restarts.reset();
        queueTimeouts.reset();
        execTimeouts.reset();
        startTimeouts.reset();
        tasksCompleted.reset();
        tasksFailed.reset();
        dagCacheHits.reset();
        dagCacheMisses.reset();
        timingStats.clear();
    }
}
