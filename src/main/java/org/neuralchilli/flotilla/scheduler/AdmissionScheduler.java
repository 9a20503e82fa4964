package org.neuralchilli.flotilla.scheduler;

import io.quarkus.vertx.ConsumeEvent;
import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.flotilla.core.LifecycleStateMachine;
import org.neuralchilli.flotilla.core.PlacementOutcome;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.monitoring.SchedulingMonitor;
import org.neuralchilli.flotilla.quota.AdmissionDecision;
import org.neuralchilli.flotilla.quota.QuotaLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Per-pool admission queues of ready groups.
 * <p>
 * An admission pass looks at the head of a pool's queue and asks the ledger for a
 * reservation. Admitted groups leave the queue and are handed to the lifecycle state
 * machine for placement; a blocked head stops the pass, so nothing is admitted past it.
 * Passes run synchronously in test mode and via the {@code pool.admit} event bus
 * address otherwise. At most one pass runs per pool at a time; a request arriving
 * during a pass makes that pass run once more.
 */
@ApplicationScoped
public class AdmissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(AdmissionScheduler.class);

    static final String ADMIT_ADDRESS = "pool.admit";

    @Inject
    QuotaLedger ledger;

    @Inject
    LifecycleStateMachine lifecycle;

    @Inject
    SchedulingMonitor monitor;

    @Inject
    EventBus eventBus;

    @ConfigProperty(name = "orchestrator.test-mode", defaultValue = "false")
    boolean testMode;

    private final Map<String, PoolQueue> queues = new ConcurrentHashMap<>();

    public void enqueue(QueuedGroup group) {
        queue(group.pool()).add(group);
        log.debug("Queued group {} in pool {} ({}, demand {})",
                group.key(), group.pool(), group.priority(), group.demand());
    }

    /**
     * Take a group out of whichever queue holds it.
     */
    public boolean remove(GroupKey key) {
        boolean removed = false;
        for (PoolQueue queue : queues.values()) {
            removed |= queue.removeIf(group -> group.key().equals(key));
        }
        return removed;
    }

    /**
     * Take every queued group of a workflow out of the queues.
     *
     * @return number of groups removed
     */
    public int removeWorkflow(UUID workflowId) {
        int removed = 0;
        for (PoolQueue queue : queues.values()) {
            removed += queue.removeAll(group -> group.key().workflowId().equals(workflowId));
        }
        if (removed > 0) {
            log.debug("Removed {} queued group(s) of workflow {}", removed, workflowId);
        }
        return removed;
    }

    public boolean isQueued(GroupKey key) {
        return queues.values().stream().anyMatch(queue -> queue.contains(key));
    }

    /**
     * Queue of a pool in admission order
     */
    public List<QueuedGroup> queueSnapshot(String pool) {
        PoolQueue queue = queues.get(pool);
        return queue == null ? List.of() : queue.snapshot();
    }

    /**
     * Run an admission pass for a pool: directly in test mode, on the event bus otherwise.
     */
    public void requestAdmission(String pool) {
        if (testMode) {
            tryAdmit(pool);
        } else {
            eventBus.publish(ADMIT_ADDRESS, pool);
        }
    }

    /**
     * Request a pass for every pool that has queued groups.
     */
    public void requestAdmissionAll() {
        for (Map.Entry<String, PoolQueue> entry : queues.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                requestAdmission(entry.getKey());
            }
        }
    }

    @ConsumeEvent(value = ADMIT_ADDRESS, blocking = true)
    public void onAdmitRequest(String pool) {
        tryAdmit(pool);
    }

    /**
     * Admit groups from the head of the pool's queue until the head is blocked or the
     * queue is empty.
     *
     * @return number of groups admitted
     */
    public int tryAdmit(String poolName) {
        PoolQueue queue = queue(poolName);
        if (queue.passLock.isHeldByCurrentThread() || !queue.passLock.tryLock()) {
            // The running pass picks this up
            queue.rerun.set(true);
            return 0;
        }

        int admitted = 0;
        try {
            do {
                queue.rerun.set(false);
                admitted += runPass(poolName, queue);
            } while (queue.rerun.get());
        } finally {
            queue.passLock.unlock();
        }
        return admitted;
    }

    public void reset() {
        queues.clear();
    }

    private int runPass(String poolName, PoolQueue queue) {
        Optional<Pool> pool = ledger.pool(poolName);
        if (pool.isEmpty() || !pool.get().isOnline()) {
            log.debug("Pool {} is not online, nothing admitted", poolName);
            return 0;
        }

        SchedulingMonitor.Timer timer = monitor.startTimer("admission.pass");
        int admitted = 0;
        try {
            QueuedGroup head;
            while ((head = queue.peek()) != null) {
                if (ledger.reservation(head.key()).isPresent()) {
                    log.warn("Group {} already holds a reservation, dropping it from the queue", head.key());
                    queue.remove(head);
                    continue;
                }

                AdmissionDecision decision = ledger.reserve(
                        poolName, head.key(), head.priority(), head.demand(), head.sequence());
                if (!decision.isAdmitted()) {
                    log.debug("Head of pool {} blocked: {} ({})",
                            poolName, head.key(), ((AdmissionDecision.Blocked) decision).reason());
                    break;
                }

                AdmissionDecision.Admitted grant = (AdmissionDecision.Admitted) decision;
                queue.remove(head);
                monitor.recordAdmission(grant.reservation().isBorrowing());
                log.info("Admitted group {} to pool {} ({}, own {}, borrowed {})",
                        head.key(), poolName, head.priority(),
                        grant.reservation().own(), grant.reservation().borrowed());

                if (!grant.preempted().isEmpty()) {
                    monitor.recordPreemption(grant.preempted().size());
                    lifecycle.preempt(grant.preempted());
                }

                PlacementOutcome outcome = lifecycle.admit(head.key(), grant.reservation());
                if (outcome == PlacementOutcome.PLACED) {
                    admitted++;
                } else if (outcome == PlacementOutcome.REJECTED) {
                    // Retried on the next pass for this pool
                    queue.add(head);
                    break;
                } else if (ledger.reservation(head.key()).filter(grant.reservation()::equals).isPresent()) {
                    ledger.release(head.key());
                }
            }
        } finally {
            timer.stop();
        }
        return admitted;
    }

    private PoolQueue queue(String pool) {
        return queues.computeIfAbsent(pool, name -> new PoolQueue());
    }

    /**
     * Ordered queue of one pool. Queue operations are short and synchronized;
     * the pass lock serializes admission passes.
     */
    private static final class PoolQueue {
        private final TreeSet<QueuedGroup> groups = new TreeSet<>(QueuedGroup.ADMISSION_ORDER);
        private final ReentrantLock passLock = new ReentrantLock();
        private final AtomicBoolean rerun = new AtomicBoolean(false);

        synchronized void add(QueuedGroup group) {
            groups.removeIf(existing -> existing.key().equals(group.key()));
            groups.add(group);
        }

        synchronized QueuedGroup peek() {
            return groups.isEmpty() ? null : groups.first();
        }

        synchronized boolean remove(QueuedGroup group) {
            return groups.remove(group);
        }

        synchronized boolean removeIf(Predicate<QueuedGroup> filter) {
            return groups.removeIf(filter);
        }

        synchronized int removeAll(Predicate<QueuedGroup> filter) {
            int before = groups.size();
            groups.removeIf(filter);
            return before - groups.size();
        }

        synchronized boolean contains(GroupKey key) {
            return groups.stream().anyMatch(group -> group.key().equals(key));
        }

        synchronized boolean isEmpty() {
            return groups.isEmpty();
        }

        synchronized List<QueuedGroup> snapshot() {
            return new ArrayList<>(groups);
        }
    }
}
