package org.neuralchilli.flotilla.config;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.flotilla.domain.Platform;
import org.neuralchilli.flotilla.domain.Pool;
import org.neuralchilli.flotilla.quota.QuotaLedger;
import org.neuralchilli.flotilla.scheduler.AdmissionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads pool definitions from YAML into the quota ledger.
 * The configured location is tried as a file first, then as a classpath resource.
 */
@ApplicationScoped
public class PoolConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PoolConfigLoader.class);

    @Inject
    YamlParser yamlParser;

    @Inject
    QuotaLedger ledger;

    @Inject
    AdmissionScheduler scheduler;

    @ConfigProperty(name = "orchestrator.config.pools", defaultValue = "pools.yaml")
    String poolsPath;

    void onStart(@Observes StartupEvent event) {
        log.info("Loading pools from: {}", poolsPath);
        logResult(load());
    }

    /**
     * Load the configured pools file
     */
    public LoadResult load() {
        Path path = Path.of(poolsPath);
        if (Files.isRegularFile(path)) {
            return load(path);
        }

        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(poolsPath)) {
            if (in == null) {
                log.warn("Pools file not found on disk or classpath: {}", poolsPath);
                return new LoadResult.Failed(poolsPath, "Pools file not found");
            }
            return install("classpath:" + poolsPath, yamlParser.parsePools(in));
        } catch (IOException e) {
            log.error("✗ Failed to read pools resource: {}", poolsPath, e);
            return LoadResult.failed(poolsPath, e);
        } catch (Exception e) {
            log.error("✗ Failed to load pools from resource: {}", poolsPath, e);
            return LoadResult.failed(poolsPath, e);
        }
    }

    /**
     * Load pools from a file
     */
    public LoadResult load(Path path) {
        try {
            log.debug("Loading pools from: {}", path);
            String yaml = Files.readString(path);
            return install(path.toString(), yamlParser.parsePools(yaml));
        } catch (IOException e) {
            log.error("✗ Failed to read pools file: {}", path, e);
            return LoadResult.failed(path.toString(), e);
        } catch (Exception e) {
            log.error("✗ Failed to load pools from: {}", path, e);
            return LoadResult.failed(path.toString(), e);
        }
    }

    /**
     * Reload pools after the file changed (dev mode hot reload)
     */
    public LoadResult reload(Path path) {
        log.info("Reloading pools: {}", path);
        LoadResult result = load(path);
        logResult(result);
        return result;
    }

    /**
     * Configured location of the pools file
     */
    public String poolsPath() {
        return poolsPath;
    }

    private LoadResult install(String source, List<Pool> pools) {
        validate(pools);
        ledger.configure(pools);
        List<String> names = pools.stream().map(Pool::name).collect(Collectors.toList());
        for (Pool pool : pools) {
            log.info("✓ Loaded pool: {} ({}, backend {}, {} platform(s))",
                    pool.name(), pool.status(), pool.backend(), pool.platforms().size());
        }
        // Quota or status may have changed under queued groups
        scheduler.requestAdmissionAll();
        return LoadResult.loaded(source, names);
    }

    private static void validate(List<Pool> pools) {
        if (pools.isEmpty()) {
            throw new IllegalArgumentException("No pools defined");
        }
        Set<String> names = new HashSet<>();
        for (Pool pool : pools) {
            if (!names.add(pool.name())) {
                throw new IllegalArgumentException("Duplicate pool name: " + pool.name());
            }
            Set<String> platforms = new HashSet<>();
            for (Platform platform : pool.platforms()) {
                if (!platforms.add(platform.name())) {
                    throw new IllegalArgumentException(
                            "Duplicate platform '" + platform.name() + "' in pool '" + pool.name() + "'");
                }
            }
            if (pool.platforms().isEmpty()) {
                log.warn("Pool {} has no platforms, every submission to it will be rejected", pool.name());
            }
        }
    }

    private void logResult(LoadResult result) {
        if (result.isSuccess()) {
            log.info("Loaded {} pool(s) from {}", result.pools().size(), result.source());
        } else {
            log.error("Failed to load pools from {}: {}", result.source(), result.error().orElse("unknown error"));
        }
    }
}
