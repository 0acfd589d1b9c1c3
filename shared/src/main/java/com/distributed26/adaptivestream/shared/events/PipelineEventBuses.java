package com.distributed26.adaptivestream.shared.events;

import com.distributed26.adaptivestream.shared.config.EnvConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class PipelineEventBuses {
    private static final Logger LOGGER = LogManager.getLogger(PipelineEventBuses.class);

    private PipelineEventBuses() {
    }

    /**
     * RabbitMQ unless {@code EVENT_BUS=memory}. A broker that cannot be reached degrades to the
     * in-memory bus, so events stay inside this process.
     */
    public static PipelineEventBus fromEnv(EnvConfig env, String serviceName) {
        String mode = env.get("EVENT_BUS", "event.bus", "rabbitmq");
        if ("memory".equalsIgnoreCase(mode)) {
            LOGGER.info("Using in-memory pipeline event bus");
            return new InMemoryPipelineEventBus();
        }
        try {
            return RabbitMQPipelineEventBus.fromEnv(env, serviceName);
        } catch (IllegalStateException e) {
            LOGGER.warn("RabbitMQ unavailable; falling back to in-memory event bus: {}", e.getMessage());
            return new InMemoryPipelineEventBus();
        }
    }
}
