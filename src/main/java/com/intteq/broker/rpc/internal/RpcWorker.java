package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.MessageContext;
import com.intteq.broker.rpc.RpcProperties;
import com.intteq.broker.rpc.rabbitmq.RpcTopology;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.context.SmartLifecycle;
import org.springframework.lang.Nullable;

import java.util.concurrent.TimeUnit;

/**
 * Consumer of the requests queue.
 *
 * <p>One consumer with prefetch 1 and manual acknowledgement: a worker holds at most
 * one unacknowledged request at a time. Scale out by running more workers.
 *
 * <p>The topology is declared before consuming starts. A declaration that conflicts
 * with existing broker objects aborts startup.
 */
@Slf4j
public class RpcWorker implements SmartLifecycle {

    static final int PREFETCH = 1;

    private final ConnectionFactory connectionFactory;
    private final RpcTopology topology;
    private final RequestProcessor processor;
    private final RpcProperties properties;

    /** Optional Micrometer registry (null-safe). */
    @Nullable
    private final MeterRegistry meterRegistry;

    private volatile SimpleMessageListenerContainer container;

    public RpcWorker(ConnectionFactory connectionFactory,
                     RpcTopology topology,
                     RequestProcessor processor,
                     RpcProperties properties,
                     @Nullable MeterRegistry meterRegistry) {
        this.connectionFactory = connectionFactory;
        this.topology = topology;
        this.processor = processor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    @Override
    public synchronized void start() {
        if (container != null) {
            return;
        }
        topology.declare();

        String queueName = properties.getRequests().getName();
        SimpleMessageListenerContainer created = createContainer(queueName);
        created.afterPropertiesSet();
        created.start();
        container = created;

        log.info("RPC worker started → queue={} prefetch={}", queueName, PREFETCH);
    }

    @Override
    public synchronized void stop() {
        if (container == null) {
            return;
        }
        log.info("Stopping RPC worker...");
        container.stop();
        container.destroy();
        container = null;
    }

    @Override
    public boolean isRunning() {
        SimpleMessageListenerContainer current = container;
        return current != null && current.isRunning();
    }

    // =====================================================================
    // CONTAINER
    // =====================================================================

    SimpleMessageListenerContainer createContainer(String queueName) {
        SimpleMessageListenerContainer c = new SimpleMessageListenerContainer(connectionFactory);

        c.setQueueNames(queueName);
        c.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        c.setPrefetchCount(PREFETCH);
        c.setConcurrentConsumers(1);
        c.setMaxConcurrentConsumers(1);
        c.setMissingQueuesFatal(false);
        c.setRecoveryInterval(properties.getWorker().getRecoveryIntervalMs());

        c.setMessageListener((ChannelAwareMessageListener) (message, channel) -> {
            long tag = message.getMessageProperties().getDeliveryTag();
            long start = System.nanoTime();

            DeliveryState state = processor.process(message, MessageContext.forRabbitMQ(channel, tag));

            recordLatency(state, System.nanoTime() - start);
        });
        return c;
    }

    // =====================================================================
    // METRICS
    // =====================================================================

    private void recordLatency(DeliveryState state, long durationNs) {
        if (meterRegistry == null) return;

        meterRegistry.timer(
                        "rpc.worker.latency",
                        "state",
                        state.name().toLowerCase()
                )
                .record(durationNs, TimeUnit.NANOSECONDS);
    }
}
