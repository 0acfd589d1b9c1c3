package com.distributed26.adaptivestream.shared.events;

import com.distributed26.adaptivestream.shared.config.EnvConfig;
import com.distributed26.adaptivestream.shared.model.RenditionStatus;
import com.distributed26.adaptivestream.shared.model.VideoStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DeliverCallback;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Topic-exchange bus. Events are published as JSON under {@code pipeline.{type}.{videoId}};
 * each service consumes from its own durable queue bound to {@code pipeline.#}.
 */
public class RabbitMQPipelineEventBus implements PipelineEventBus, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RabbitMQPipelineEventBus.class);
    static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Connection connection;
    private final Channel channel;
    private final String exchange;
    private final String queue;
    private final ListenerRegistry registry = new ListenerRegistry();

    public static RabbitMQPipelineEventBus fromEnv(EnvConfig env, String serviceName) {
        String host = env.get("RABBITMQ_HOST", "rabbitmq.host", "localhost");
        int port = env.getInt("RABBITMQ_PORT", "rabbitmq.port", 5672);
        String user = env.get("RABBITMQ_USER", "rabbitmq.user", "guest");
        String pass = env.get("RABBITMQ_PASS", "rabbitmq.pass", "guest");
        String vhost = env.get("RABBITMQ_VHOST", "rabbitmq.vhost", "/");
        String exchange = env.get("RABBITMQ_EXCHANGE", "rabbitmq.exchange", "pipeline.events");
        String queue = env.get("RABBITMQ_QUEUE", "rabbitmq.queue", "pipeline." + serviceName + ".queue");
        return new RabbitMQPipelineEventBus(host, port, user, pass, vhost, exchange, queue, serviceName);
    }

    public RabbitMQPipelineEventBus(
            String host,
            int port,
            String username,
            String password,
            String vhost,
            String exchange,
            String queue,
            String serviceName
    ) {
        this.exchange = Objects.requireNonNull(exchange, "exchange is null");
        this.queue = Objects.requireNonNull(queue, "queue is null");

        try {
            ConnectionFactory factory = new ConnectionFactory();
            factory.setHost(host);
            factory.setPort(port);
            factory.setUsername(username);
            factory.setPassword(password);
            factory.setVirtualHost(vhost);
            this.connection = factory.newConnection(serviceName + "-pipeline-bus");
            this.channel = connection.createChannel();

            channel.exchangeDeclare(this.exchange, BuiltinExchangeType.TOPIC, true);
            channel.queueDeclare(this.queue, true, false, false, null);
            channel.queueBind(this.queue, this.exchange, "pipeline.#");
            startConsumer();
            logger.info("Connected pipeline bus to {}:{} exchange={} queue={}", host, port, exchange, queue);
        } catch (IOException | TimeoutException e) {
            throw new IllegalStateException("Failed to initialize RabbitMQPipelineEventBus", e);
        }
    }

    static String routingKey(PipelineEvent event) {
        return "pipeline." + event.getType() + "." + event.getVideoId();
    }

    @Override
    public void publish(PipelineEvent event) {
        Objects.requireNonNull(event, "event is null");
        try {
            byte[] body = objectMapper.writeValueAsBytes(event);
            synchronized (channel) {
                channel.basicPublish(exchange, routingKey(event), null, body);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to publish " + event.getType() + " event", e);
        }
    }

    @Override
    public void subscribe(String videoId, PipelineEventListener listener) {
        registry.subscribe(videoId, listener);
    }

    @Override
    public void unsubscribe(String videoId, PipelineEventListener listener) {
        registry.unsubscribe(videoId, listener);
    }

    @Override
    public void subscribeAll(PipelineEventListener listener) {
        registry.subscribeAll(listener);
    }

    private void startConsumer() throws IOException {
        DeliverCallback callback = (consumerTag, delivery) -> {
            String json = new String(delivery.getBody(), StandardCharsets.UTF_8);
            PipelineEvent event;
            try {
                event = fromJson(objectMapper.readTree(json));
            } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
                logger.warn("Dropping malformed pipeline message on {}: {}", delivery.getEnvelope().getRoutingKey(), json, e);
                return;
            }
            if (event == null) {
                logger.debug("Ignoring pipeline message of unknown type: {}", json);
                return;
            }
            registry.dispatch(event);
        };
        channel.basicConsume(queue, true, callback, consumerTag -> logger.warn("Consumer {} cancelled", consumerTag));
    }

    /** @return the decoded event, or {@code null} for an unknown type */
    static PipelineEvent fromJson(JsonNode node) {
        String videoId = node.path("videoId").asText(null);
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("missing videoId");
        }
        String timestampText = node.path("timestamp").asText(null);
        Instant timestamp = timestampText == null ? Instant.now() : Instant.parse(timestampText);
        String type = node.path("type").asText("");
        switch (type) {
            case VideoSubmittedEvent.TYPE:
                return new VideoSubmittedEvent(videoId, node.path("ownerId").asText(null), timestamp);
            case VideoStatusEvent.TYPE:
                return new VideoStatusEvent(videoId,
                        VideoStatus.valueOf(node.path("status").asText()),
                        node.path("reason").asText(null),
                        timestamp);
            case RenditionStatusEvent.TYPE:
                return new RenditionStatusEvent(videoId,
                        node.path("quality").asText(),
                        RenditionStatus.valueOf(node.path("status").asText()),
                        node.path("attempts").asInt(0),
                        node.path("reason").asText(null),
                        timestamp);
            default:
                return null;
        }
    }

    @Override
    public void close() throws Exception {
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
        if (connection != null && connection.isOpen()) {
            connection.close();
        }
    }
}
