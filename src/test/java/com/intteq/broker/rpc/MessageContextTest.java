package com.intteq.broker.rpc;

import com.rabbitmq.client.Channel;

import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.Mock;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;

@ExtendWith(MockitoExtension.class)
public class MessageContextTest {

    @Mock
    private Channel channel;

    @Test
    public void ackSettlesOnce() throws Exception {
        MessageContext context = MessageContext.forRabbitMQ(channel, 5L);

        context.ack();

        Assertions.assertTrue(context.isSettled());
        verify(channel).basicAck(5L, false);
        Assertions.assertThrows(IllegalStateException.class, () -> context.reject(true));
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    public void rejectRequeues() throws Exception {
        MessageContext context = MessageContext.forRabbitMQ(channel, 6L);

        context.reject(true);

        verify(channel).basicNack(6L, false, true);
    }

    @Test
    public void channelFailureIsWrapped() throws Exception {
        doThrow(new IOException("channel closed")).when(channel).basicAck(7L, false);
        MessageContext context = MessageContext.forRabbitMQ(channel, 7L);

        Assertions.assertThrows(MessageContext.MessagingOperationException.class, context::ack);
        Assertions.assertTrue(context.isSettled());
    }

    @Test
    public void channelIsRequired() {
        Assertions.assertThrows(NullPointerException.class, () -> MessageContext.forRabbitMQ(null, 1L));
    }
}
