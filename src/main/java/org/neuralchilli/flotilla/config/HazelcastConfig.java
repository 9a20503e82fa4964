package org.neuralchilli.flotilla.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.flotilla.domain.TaskInstance;
import org.neuralchilli.flotilla.serializer.TaskInstanceSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the embedded Hazelcast member that holds workflow and task state.
 * Task instances use a custom serializer; workflow records use Java serialization.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "hazelcast.cluster-name", defaultValue = "flotilla-dev")
    String clusterName;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);
        HazelcastInstance instance = Hazelcast.newHazelcastInstance(baseConfig(clusterName));
        log.info("Hazelcast instance created successfully");
        return instance;
    }

    /**
     * Embedded member configuration with discovery disabled and serializers registered.
     * Shared with the test producer.
     */
    public static Config baseConfig(String clusterName) {
        Config config = new Config();
        config.setClusterName(clusterName);

        // Disable network join for embedded instance
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        SerializationConfig serializationConfig = config.getSerializationConfig();
        serializationConfig.setEnableCompression(false);
        serializationConfig.setEnableSharedObject(false);
        registerCustomSerializers(serializationConfig);
        return config;
    }

    private static void registerCustomSerializers(SerializationConfig serializationConfig) {
        SerializerConfig taskInstanceSerializerConfig = new SerializerConfig()
                .setTypeClass(TaskInstance.class)
                .setImplementation(new TaskInstanceSerializer());
        serializationConfig.addSerializerConfig(taskInstanceSerializerConfig);
        log.debug("Registered TaskInstanceSerializer (TYPE_ID: 1001)");
    }
}
