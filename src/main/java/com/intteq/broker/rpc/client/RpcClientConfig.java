package com.intteq.broker.rpc.client;

import com.intteq.broker.rpc.RpcProperties;
import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.internal.RpcPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.AnonymousQueue;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Client side wiring, enabled with {@code rpc.client.enabled=true}.
 *
 * <p>The reply queue is a server-named, exclusive, auto-delete queue owned by this
 * process for its whole lifetime. Every call made through the {@link RpcClient} names
 * it as reply-to.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "rpc.client", name = "enabled", havingValue = "true")
public class RpcClientConfig {

    @Bean
    public AnonymousQueue rpcReplyQueue() {
        return new AnonymousQueue();
    }

    @Bean
    public RpcClient rpcClient(RpcPublisher publisher,
                               EnvelopeCodec codec,
                               RpcProperties props,
                               AnonymousQueue rpcReplyQueue,
                               @Nullable MeterRegistry meterRegistry) {
        return new RpcClient(publisher, codec, rpcReplyQueue.getName(), props.getRpcTimeout(), meterRegistry);
    }

    @Bean
    public SimpleMessageListenerContainer rpcReplyListener(ConnectionFactory connectionFactory,
                                                           AnonymousQueue rpcReplyQueue,
                                                           RpcClient rpcClient) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueues(rpcReplyQueue);
        container.setAcknowledgeMode(AcknowledgeMode.NONE);
        container.setMessageListener(rpcClient::onReply);

        log.info("RPC reply listener configured → queue={}", rpcReplyQueue.getName());
        return container;
    }
}
