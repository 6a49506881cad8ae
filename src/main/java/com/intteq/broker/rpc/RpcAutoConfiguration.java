package com.intteq.broker.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.broker.rpc.dispatch.ActionDispatcher;
import com.intteq.broker.rpc.dispatch.Authenticator;
import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.internal.RequestProcessor;
import com.intteq.broker.rpc.internal.RetryPipeline;
import com.intteq.broker.rpc.internal.RpcActionRegistrar;
import com.intteq.broker.rpc.internal.RpcPublisher;
import com.intteq.broker.rpc.internal.RpcWorker;
import com.intteq.broker.rpc.ledger.IdempotencyLedger;
import com.intteq.broker.rpc.ledger.JpaIdempotencyLedger;
import com.intteq.broker.rpc.ledger.ProcessedRequestRepository;
import com.intteq.broker.rpc.rabbitmq.RpcTopology;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Wiring of the RPC core: codec, publisher, dispatcher, ledger, retry pipeline and
 * the request worker.
 *
 * <p>The worker is enabled by default and can be disabled by setting:
 *
 * <pre>
 *   rpc.worker.enabled = false
 * </pre>
 *
 * <p>The {@link MeterRegistry} is optional. Metrics are skipped when it is absent.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(RpcProperties.class)
public class RpcAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }

    @Bean
    public RpcPublisher rpcPublisher(RabbitTemplate rabbitTemplate,
                                     RpcProperties props,
                                     EnvelopeCodec codec,
                                     @Nullable MeterRegistry meterRegistry) {
        return new RpcPublisher(rabbitTemplate, props, codec, meterRegistry);
    }

    @Bean
    public RpcTopology rpcTopology(RpcProperties props, AmqpAdmin amqpAdmin) {
        return new RpcTopology(props, amqpAdmin);
    }

    /**
     * Exposed so that the admin re-declares the topology after a connection recovery.
     */
    @Bean
    public Declarables rpcDeclarables(RpcTopology topology) {
        return topology.declarables();
    }

    // ========================================================================
    //   Dispatch
    // ========================================================================

    @Bean
    public ActionDispatcher actionDispatcher(Authenticator authenticator, RpcProperties props) {
        return new ActionDispatcher(authenticator, props.isSimulatedFaultsEnabled());
    }

    @Bean
    public RpcActionRegistrar rpcActionRegistrar(ApplicationContext ctx, ActionDispatcher dispatcher) {
        return new RpcActionRegistrar(ctx, dispatcher);
    }

    // ========================================================================
    //   Ledger
    // ========================================================================

    @Bean
    public IdempotencyLedger idempotencyLedger(ProcessedRequestRepository repository,
                                               PlatformTransactionManager transactionManager,
                                               EnvelopeCodec codec,
                                               Clock clock) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return new JpaIdempotencyLedger(repository, template, codec, clock);
    }

    // ========================================================================
    //   Worker
    // ========================================================================

    @Bean
    public RetryPipeline retryPipeline(IdempotencyLedger ledger,
                                       RpcPublisher publisher,
                                       EnvelopeCodec codec,
                                       RpcProperties props,
                                       Clock clock,
                                       @Nullable MeterRegistry meterRegistry) {
        return new RetryPipeline(ledger, publisher, codec, props, clock, meterRegistry);
    }

    @Bean
    public RequestProcessor requestProcessor(EnvelopeCodec codec,
                                             IdempotencyLedger ledger,
                                             ActionDispatcher dispatcher,
                                             RetryPipeline pipeline) {
        return new RequestProcessor(codec, ledger, dispatcher, pipeline);
    }

    @Bean
    @ConditionalOnProperty(prefix = "rpc.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RpcWorker rpcWorker(ConnectionFactory connectionFactory,
                               RpcTopology topology,
                               RequestProcessor processor,
                               RpcProperties props,
                               @Nullable MeterRegistry meterRegistry) {
        return new RpcWorker(connectionFactory, topology, processor, props, meterRegistry);
    }
}
