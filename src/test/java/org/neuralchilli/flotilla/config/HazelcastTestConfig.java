package org.neuralchilli.flotilla.config;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.test.Mock;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Isolated, in-memory Hazelcast member for tests, with the production serializers.
 */
@Mock
@Alternative
@ApplicationScoped
public class HazelcastTestConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastTestConfig.class);

    @ConfigProperty(name = "hazelcast.cluster-name", defaultValue = "flotilla-test")
    String clusterName;

    private HazelcastInstance instance;

    @Produces
    @Singleton
    @Alternative
    public HazelcastInstance hazelcastInstance() {
        if (instance != null) {
            return instance;
        }

        log.info("Creating test Hazelcast instance with cluster: {}", clusterName);
        Config config = HazelcastConfig.baseConfig(clusterName);

        // Fast operation timeout for tests
        config.setProperty("hazelcast.operation.call.timeout.millis", "5000");

        // Writes are immediately visible
        config.getMapConfig("*").setBackupCount(0).setAsyncBackupCount(0);

        config.getMetricsConfig().setEnabled(false);

        instance = Hazelcast.newHazelcastInstance(config);
        return instance;
    }

    @PreDestroy
    void cleanup() {
        if (instance != null && instance.getLifecycleService().isRunning()) {
            log.info("Shutting down test Hazelcast instance");
            instance.getLifecycleService().shutdown();
            instance = null;
        }
    }
}
