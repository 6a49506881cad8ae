package com.intteq.broker.rpc.rabbitmq;

import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.Mock;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

@ExtendWith(MockitoExtension.class)
public class RabbitMQConfigTest {

    @Mock
    private ConnectionFactory connectionFactory;

    @Test
    public void templateGetsBothPublisherCallbacks() {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);

        new RabbitMQConfig().rpcTemplateCustomizer().customize(template);

        // A template accepts a single confirm callback and a single returns callback.
        Assertions.assertThrows(IllegalStateException.class,
                () -> template.setConfirmCallback((cd, ack, cause) -> { }));
        Assertions.assertThrows(IllegalStateException.class,
                () -> template.setReturnsCallback(returned -> { }));
    }
}
