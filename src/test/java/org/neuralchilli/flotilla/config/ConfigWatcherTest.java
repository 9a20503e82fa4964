package org.neuralchilli.flotilla.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Drives the watcher against a real directory. Slower than the other config tests.
 */
class ConfigWatcherTest {

    private static final String POOLS = """
            pools:
              - name: gpu-pool
                backend: test-cluster
                platforms: [{ name: standard, gpu: 8, cpu: 64 }]
            """;

    private Path tempDir;
    private Path poolsFile;
    private PoolConfigLoader loader;
    private ConfigWatcher watcher;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("flotilla-watch-");
        poolsFile = tempDir.resolve("pools.yaml").toAbsolutePath();
        Files.writeString(poolsFile, POOLS);

        loader = mock(PoolConfigLoader.class);
        when(loader.poolsPath()).thenReturn(poolsFile.toString());
        when(loader.reload(any(Path.class)))
                .thenReturn(LoadResult.loaded(poolsFile.toString(), List.of("gpu-pool")));

        watcher = new ConfigWatcher();
        watcher.loader = loader;
        watcher.watchEnabled = true;
    }

    @AfterEach
    void teardown() throws IOException {
        watcher.onStop(null);
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> path.toFile().delete());
        }
    }

    @Test
    void shouldReloadWhenPoolsFileChanges() throws IOException {
        // Given
        watcher.onStart(null);

        // When
        Files.writeString(poolsFile, POOLS.replace("gpu: 8", "gpu: 16"));

        // Then
        verify(loader, timeout(10_000).atLeastOnce()).reload(poolsFile);
    }

    @Test
    void shouldIgnoreOtherFilesInDirectory() throws IOException {
        // Given
        watcher.onStart(null);

        // When
        Files.writeString(tempDir.resolve("notes.txt"), "not a pools file");

        // Then
        verify(loader, after(2_000).never()).reload(any(Path.class));
    }

    @Test
    void shouldKeepPoolsWhenFileIsDeleted() throws IOException {
        // Given
        watcher.onStart(null);

        // When
        Files.delete(poolsFile);

        // Then
        verify(loader, after(2_000).never()).reload(any(Path.class));
    }

    @Test
    void shouldNotWatchWhenDisabled() throws IOException {
        // Given
        watcher.watchEnabled = false;
        watcher.onStart(null);

        // When
        Files.writeString(poolsFile, POOLS.replace("gpu: 8", "gpu: 4"));

        // Then
        verify(loader, after(2_000).never()).reload(any(Path.class));
        verify(loader, never()).poolsPath();
    }
}
