package com.intteq.broker.rpc.rabbitmq;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.amqp.RabbitTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishing behaviour of the auto-configured {@link RabbitTemplate}.
 *
 * <p>Connection factory, template and admin are created by Spring Boot from
 * {@code spring.rabbitmq.*}, including publisher confirms and returns. Every publish is
 * mandatory: a message no queue accepts comes back and is logged.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RabbitMQConfig {

    @Bean
    public RabbitTemplateCustomizer rpcTemplateCustomizer() {
        return RabbitMQConfig::customize;
    }

    static void customize(RabbitTemplate template) {
        template.setMandatory(true);

        template.setConfirmCallback((CorrelationData cd, boolean ack, String cause) -> {
            if (ack) {
                log.debug("Publish confirmed: correlationId={}", cd != null ? cd.getId() : null);
            } else {
                log.error("Publish failed: correlationId={} cause={}",
                        cd != null ? cd.getId() : null, cause);
            }
        });

        // An unroutable response usually means the client's reply queue is gone.
        template.setReturnsCallback(returned ->
                log.error("Returned message: exchange={} routingKey={} replyCode={} replyText={}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyCode(),
                        returned.getReplyText())
        );
    }
}
