package org.neuralchilli.flotilla.config;

import io.quarkus.arc.profile.IfBuildProfile;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Watches the pools file and reloads pool definitions when it changes.
 * Only active in dev mode.
 */
@ApplicationScoped
@IfBuildProfile("dev")
public class ConfigWatcher {

    private static final Logger log = LoggerFactory.getLogger(ConfigWatcher.class);

    @Inject
    PoolConfigLoader loader;

    @ConfigProperty(name = "orchestrator.config.watch", defaultValue = "true")
    boolean watchEnabled;

    private WatchService watchService;
    private ExecutorService executor;
    private Path poolsFile;
    private volatile boolean running = false;

    void onStart(@Observes StartupEvent event) {
        if (!watchEnabled) {
            log.info("Config watching is disabled");
            return;
        }

        try {
            startWatching();
        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stopWatching();
    }

    private void startWatching() throws IOException {
        poolsFile = Path.of(loader.poolsPath()).toAbsolutePath();
        Path directory = poolsFile.getParent();
        if (!Files.isRegularFile(poolsFile) || directory == null) {
            log.warn("Pools file {} is not on disk, nothing to watch", poolsFile);
            return;
        }

        watchService = FileSystems.getDefault().newWatchService();
        directory.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);

        running = true;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        executor.submit(this::watchLoop);

        log.info("Watching pools file: {}", poolsFile);
    }

    private void watchLoop() {
        while (running) {
            try {
                WatchKey key = watchService.poll(1, TimeUnit.SECONDS);
                if (key == null) {
                    continue;
                }

                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == OVERFLOW) {
                        log.warn("Watch event overflow, reloading pools");
                        loader.reload(poolsFile);
                        continue;
                    }
                    Path changed = ((Path) key.watchable()).resolve((Path) event.context());
                    if (changed.equals(poolsFile)) {
                        handleChange(event.kind());
                    }
                }

                if (!key.reset()) {
                    log.warn("Watch key no longer valid, stopping watcher");
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error in watch loop", e);
            }
        }
    }

    private void handleChange(WatchEvent.Kind<?> kind) {
        if (kind == ENTRY_DELETE) {
            // Keep the last good definitions
            log.warn("Pools file deleted: {} (pools unchanged)", poolsFile);
            return;
        }
        LoadResult result = loader.reload(poolsFile);
        if (result.isSuccess()) {
            log.info("✓ Reloaded pools: {}", result.pools());
        } else {
            log.error("✗ Failed to reload pools, keeping previous definitions: {}",
                    result.error().orElse("unknown error"));
        }
    }

    private void stopWatching() {
        if (watchService == null) {
            return;
        }
        running = false;

        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        try {
            watchService.close();
        } catch (IOException e) {
            log.error("Error closing watch service", e);
        }
        log.info("Config watcher stopped");
    }
}
