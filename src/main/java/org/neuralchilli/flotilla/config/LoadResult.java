package org.neuralchilli.flotilla.config;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of loading a pool configuration file.
 */
public sealed interface LoadResult {

    /**
     * Where the configuration was read from
     */
    String source();

    boolean isSuccess();

    /**
     * Names of the pools installed into the ledger, empty on failure
     */
    List<String> pools();

    Optional<String> error();

    record Loaded(String source, List<String> pools) implements LoadResult {
        public Loaded {
            pools = List.copyOf(pools);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failed(String source, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public List<String> pools() {
            return List.of();
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult loaded(String source, List<String> pools) {
        return new Loaded(source, pools);
    }

    static LoadResult failed(String source, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new Failed(source, message);
    }
}
