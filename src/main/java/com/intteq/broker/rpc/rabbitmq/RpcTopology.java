package com.intteq.broker.rpc.rabbitmq;

import com.intteq.broker.rpc.RpcProperties;
import com.intteq.broker.rpc.exception.TopologyDeclarationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Broker objects used by the RPC layer:
 * <ul>
 *     <li>one durable direct exchange</li>
 *     <li>durable requests, responses, retry and dead-letter queues, each bound by its routing key</li>
 *     <li>the retry queue expires messages after the retry delay and dead-letters
 *         them back to the exchange with the requests routing key</li>
 * </ul>
 *
 * <p>Declaration is idempotent. Re-declaring an object with different arguments is
 * refused by the broker and surfaces as {@link TopologyDeclarationException}.
 */
@Slf4j
public class RpcTopology {

    static final String MESSAGE_TTL = "x-message-ttl";
    static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

    private final RpcProperties props;
    private final AmqpAdmin admin;

    public RpcTopology(RpcProperties props, AmqpAdmin admin) {
        this.props = props;
        this.admin = admin;
    }

    public Declarables declarables() {
        List<Declarable> declarables = new ArrayList<>();

        DirectExchange exchange = new DirectExchange(props.getExchange(), true, false);
        declarables.add(exchange);

        addQueue(declarables, exchange, props.getRequests(), QueueBuilder.durable(props.getRequests().getName()));
        addQueue(declarables, exchange, props.getResponses(), QueueBuilder.durable(props.getResponses().getName()));
        addQueue(declarables, exchange, props.getDeadLetter(), QueueBuilder.durable(props.getDeadLetter().getName()));
        addQueue(declarables, exchange, props.getRetry(), QueueBuilder.durable(props.getRetry().getName())
                .withArgument(MESSAGE_TTL, props.getRetryDelayMs())
                .withArgument(DEAD_LETTER_EXCHANGE, props.getExchange())
                .withArgument(DEAD_LETTER_ROUTING_KEY, props.getRequests().getRoutingKey()));

        return new Declarables(declarables);
    }

    /**
     * Declare every object on the broker.
     *
     * @throws TopologyDeclarationException if the broker rejects a declaration
     */
    public void declare() {
        for (Declarable declarable : declarables().getDeclarables()) {
            try {
                if (declarable instanceof Exchange) {
                    admin.declareExchange((Exchange) declarable);
                } else if (declarable instanceof Queue) {
                    admin.declareQueue((Queue) declarable);
                } else if (declarable instanceof Binding) {
                    admin.declareBinding((Binding) declarable);
                }
            } catch (AmqpException e) {
                throw new TopologyDeclarationException("Failed to declare " + declarable, e);
            }
        }
        log.info("RPC topology declared on exchange '{}'", props.getExchange());
    }

    private void addQueue(List<Declarable> declarables, DirectExchange exchange,
                          RpcProperties.QueueConfig cfg, QueueBuilder builder) {
        Queue queue = builder.build();
        declarables.add(queue);
        declarables.add(BindingBuilder.bind(queue).to(exchange).with(cfg.getRoutingKey()));

        log.debug("Queue {} bound to exchange={} routingKey={}", cfg.getName(), exchange.getName(), cfg.getRoutingKey());
    }
}
