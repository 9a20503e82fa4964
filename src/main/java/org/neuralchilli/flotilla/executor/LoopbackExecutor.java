package org.neuralchilli.flotilla.executor;

import io.quarkus.arc.DefaultBean;
import io.quarkus.runtime.ShutdownEvent;
import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.flotilla.domain.GroupKey;
import org.neuralchilli.flotilla.domain.TaskEvent;
import org.neuralchilli.flotilla.domain.TaskPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for a compute backend, used when no real executor is deployed.
 * Accepts every gang, reports READY right away and finishes started commands with
 * exit code 0 after a fixed run time. Nothing is actually executed.
 */
@DefaultBean
@ApplicationScoped
public class LoopbackExecutor implements BackendExecutor {

    private static final Logger log = LoggerFactory.getLogger(LoopbackExecutor.class);

    static final String TASK_EVENT_ADDRESS = "task.event";

    @Inject
    EventBus eventBus;

    @ConfigProperty(name = "orchestrator.loopback.run-time", defaultValue = "PT1S")
    Duration runTime;

    private final AtomicInteger nodeCounter = new AtomicInteger(0);
    private final Map<UUID, ScheduledFuture<?>> running = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timer =
            Executors.newSingleThreadScheduledExecutor(new LoopbackThreadFactory());

    @Override
    public PlacementResult placeGang(GroupKey group, String pool, List<TaskPlacement> placements) {
        Map<UUID, String> nodes = new HashMap<>();
        for (TaskPlacement placement : placements) {
            nodes.put(placement.taskInstanceId(), "loopback-" + nodeCounter.incrementAndGet());
        }
        log.info("TRIAL RUN - placed gang {} of {} task(s) in pool {}", group, placements.size(), pool);

        for (TaskPlacement placement : placements) {
            publish(TaskEvent.of(placement.taskInstanceId(), TaskPhase.READY));
        }
        return PlacementResult.accepted(nodes);
    }

    @Override
    public void start(GroupKey group, List<UUID> taskInstanceIds) {
        log.info("TRIAL RUN - starting {} task(s) of gang {}", taskInstanceIds.size(), group);
        for (UUID id : taskInstanceIds) {
            scheduleExit(id);
        }
    }

    @Override
    public void restart(UUID taskInstanceId) {
        log.info("TRIAL RUN - restarting task {}", taskInstanceId);
        cancelTimer(taskInstanceId);
        publish(TaskEvent.of(taskInstanceId, TaskPhase.READY));
    }

    @Override
    public void cancel(UUID taskInstanceId) {
        log.info("TRIAL RUN - canceling task {}", taskInstanceId);
        cancelTimer(taskInstanceId);
    }

    void onStop(@Observes ShutdownEvent event) {
        timer.shutdownNow();
    }

    private void scheduleExit(UUID id) {
        ScheduledFuture<?> exit = timer.schedule(() -> {
            running.remove(id);
            publish(TaskEvent.exited(id, 0));
        }, runTime.toMillis(), TimeUnit.MILLISECONDS);
        running.put(id, exit);
    }

    private void cancelTimer(UUID id) {
        ScheduledFuture<?> exit = running.remove(id);
        if (exit != null) {
            exit.cancel(false);
        }
    }

    private void publish(TaskEvent event) {
        eventBus.publish(TASK_EVENT_ADDRESS, event);
    }

    private static class LoopbackThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("loopback-executor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
