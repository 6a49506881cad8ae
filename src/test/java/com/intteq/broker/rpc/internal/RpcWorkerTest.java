package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.MessageContext;
import com.intteq.broker.rpc.RpcProperties;
import com.intteq.broker.rpc.exception.TopologyDeclarationException;
import com.intteq.broker.rpc.rabbitmq.RpcTopology;
import com.rabbitmq.client.Channel;

import org.mockito.ArgumentCaptor;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.Mock;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;

@ExtendWith(MockitoExtension.class)
public class RpcWorkerTest {

    @Mock
    private ConnectionFactory connectionFactory;

    @Mock
    private RpcTopology topology;

    @Mock
    private RequestProcessor processor;

    @Mock
    private Channel channel;

    private RpcWorker worker;

    @BeforeEach
    public void setUp() {
        worker = new RpcWorker(connectionFactory, topology, processor, new RpcProperties(), null);
    }

    @Test
    public void containerHoldsOneUnackedRequestAtATime() {
        SimpleMessageListenerContainer container = worker.createContainer("api.requests");

        Assertions.assertArrayEquals(new String[]{"api.requests"}, container.getQueueNames());
        Assertions.assertEquals(AcknowledgeMode.MANUAL, container.getAcknowledgeMode());
        Assertions.assertEquals(1, ReflectionTestUtils.getField(container, "prefetchCount"));
        Assertions.assertEquals(1, ReflectionTestUtils.getField(container, "concurrentConsumers"));
        Assertions.assertEquals(1, ReflectionTestUtils.getField(container, "maxConcurrentConsumers"));
    }

    @Test
    public void listenerHandsDeliveryToProcessorWithItsTag() throws Exception {
        SimpleMessageListenerContainer container = worker.createContainer("api.requests");
        MessageProperties props = new MessageProperties();
        props.setDeliveryTag(42L);
        Message message = new Message("{}".getBytes(StandardCharsets.UTF_8), props);
        when(processor.process(eq(message), any(MessageContext.class))).thenReturn(DeliveryState.COMPLETED);

        ((ChannelAwareMessageListener) container.getMessageListener()).onMessage(message, channel);

        ArgumentCaptor<MessageContext> captor = ArgumentCaptor.forClass(MessageContext.class);
        verify(processor).process(eq(message), captor.capture());
        Assertions.assertEquals(42L, captor.getValue().deliveryTag());
        Assertions.assertSame(channel, captor.getValue().channel());
    }

    @Test
    public void failedDeclarationPreventsConsuming() {
        doThrow(new TopologyDeclarationException("queue api.requests exists with other arguments", null))
                .when(topology).declare();

        Assertions.assertThrows(TopologyDeclarationException.class, worker::start);

        Assertions.assertFalse(worker.isRunning());
        verifyNoInteractions(connectionFactory, processor);
    }
}
