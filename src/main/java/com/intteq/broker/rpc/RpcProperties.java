package com.intteq.broker.rpc;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the broker RPC layer.
 *
 * <p>Prefix: {@code rpc.*}
 *
 * <p>Examples:
 * <pre>
 * rpc.exchange=api.direct
 * rpc.requests.name=api.requests
 * rpc.requests.routing-key=api.requests
 * rpc.retry-delay-ms=5000
 * rpc.max-retries=3
 * rpc.rpc-timeout=30s
 * </pre>
 *
 * <p>Broker host, port, credentials and virtual host are read from the standard
 * {@code spring.rabbitmq.*} properties. These properties are validated at startup;
 * invalid configurations cause the application to fail fast.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "rpc")
public class RpcProperties {

    /** Durable direct exchange carrying every RPC message. */
    @NotBlank(message = "rpc.exchange must not be blank")
    private String exchange = "api.direct";

    /** Queue consumed by workers. */
    @Valid
    private QueueConfig requests = new QueueConfig("api.requests", "api.requests");

    /** Shared fallback for responses of requests that carried no reply-to. */
    @Valid
    private QueueConfig responses = new QueueConfig("api.responses", "api.responses");

    /** Delay queue: expired messages are dead-lettered back into {@link #requests}. */
    @Valid
    private QueueConfig retry = new QueueConfig("api.requests.retry", "api.requests.retry");

    /** Observability sink for failed requests. Nothing in this service consumes it. */
    @Valid
    private QueueConfig deadLetter = new QueueConfig("api.requests.dlq", "api.requests.dlq");

    /** Message TTL of the retry queue, i.e. the delay before a retried request is redelivered. */
    @Min(value = 1, message = "rpc.retry-delay-ms must be positive")
    private int retryDelayMs = 5000;

    /** Transient failures tolerated per request before it is dead-lettered. */
    @Min(value = 0, message = "rpc.max-retries must not be negative")
    private int maxRetries = 3;

    /** Default time a client waits for a response. */
    @NotNull
    private Duration rpcTimeout = Duration.ofSeconds(30);

    /**
     * Whether business errors (handler-reported failures) are also copied to the
     * dead-letter queue. Malformed requests and exhausted retries always are.
     */
    private boolean deadLetterBusinessErrors = false;

    /**
     * Honour {@code data.simulate_temp_error=true} by failing the request with a
     * transient fault. Used to exercise the retry path against a live broker.
     */
    private boolean simulatedFaultsEnabled = false;

    @Valid
    private final Worker worker = new Worker();

    @Valid
    private final Client client = new Client();

    // ========================================================================
    // Nested types
    // ========================================================================

    /**
     * Queue name and the routing key binding it to {@link #exchange}.
     */
    @Getter
    @Setter
    @ToString
    public static class QueueConfig {

        /** Queue name. Required. */
        @NotBlank(message = "queue.name must not be blank")
        private String name;

        /** Routing key for binding. Required. */
        @NotBlank(message = "queue.routingKey must not be blank")
        private String routingKey;

        public QueueConfig() {
        }

        public QueueConfig(String name, String routingKey) {
            this.name = name;
            this.routingKey = routingKey;
        }
    }

    @Getter
    @Setter
    @ToString
    public static class Worker {

        /** Start consuming the requests queue in this process. */
        private boolean enabled = true;

        /** Delay before a failed listener container tries to reconnect. */
        @Min(1)
        private long recoveryIntervalMs = 3000;
    }

    @Getter
    @Setter
    @ToString
    public static class Client {

        /** Create the RPC client and its reply listener in this process. */
        private boolean enabled = false;

        /** Run the scripted demo conversation at startup (requires {@link #enabled}). */
        private boolean demo = false;
    }
}
