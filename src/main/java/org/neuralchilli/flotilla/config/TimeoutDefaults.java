package org.neuralchilli.flotilla.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Global timeout defaults. Workflow and pool settings take precedence over the
 * queue and exec values; the start timeout bounds every start barrier.
 */
@ConfigMapping(prefix = "orchestrator.timeouts")
public interface TimeoutDefaults {

    /**
     * How long a workflow may stay PENDING
     */
    @WithName("queue")
    @WithDefault("P2D")
    Duration queue();

    /**
     * How long a workflow may run once started
     */
    @WithName("exec")
    @WithDefault("P7D")
    Duration exec();

    /**
     * How long placed tasks may wait at a start barrier
     */
    @WithName("start")
    @WithDefault("PT10M")
    Duration start();
}
