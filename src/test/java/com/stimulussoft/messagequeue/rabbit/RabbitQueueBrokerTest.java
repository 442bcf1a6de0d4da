/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an &quot;AS IS&quot; BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.stimulussoft.messagequeue.rabbit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.stimulussoft.messagequeue.AlreadyRunningException;
import com.stimulussoft.messagequeue.BrokerConfig;
import com.stimulussoft.messagequeue.BrokerNotRunningException;
import com.stimulussoft.messagequeue.HandlerResponse;
import com.stimulussoft.messagequeue.Message;
import com.stimulussoft.messagequeue.QueueBrokerException;
import com.stimulussoft.messagequeue.QueueNotFoundException;
import com.stimulussoft.messagequeue.SubscribeParams;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RabbitQueueBrokerTest {

    private final MessageCodec codec = new MessageCodec();
    private ConnectionFactory factory;
    private Connection connection;
    private Channel channel;
    private RabbitQueueBroker broker;

    @Before
    public void setUp() throws Exception {
        factory = mock(ConnectionFactory.class);
        connection = mock(Connection.class);
        channel = mock(Channel.class);
        when(factory.newConnection(anyString())).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        when(connection.isOpen()).thenReturn(true);
        when(channel.queueDeclarePassive(anyString())).thenThrow(new IOException("NOT_FOUND"));
        when(channel.waitForConfirms(anyLong())).thenReturn(true);
        when(channel.basicConsume(anyString(), eq(false), any(Consumer.class))).thenReturn("ctag-1");
        broker = new RabbitQueueBroker(BrokerConfig.config().ttlBase(1000).maxRetries(3), factory, codec);
    }

    @Test
    public void startDeclaresQueueAndWaitQueues() throws Exception {
        broker.start(ImmutableList.of("orders"));
        Assert.assertTrue(broker.isRunning());
        verify(channel).queueDeclare("orders", true, false, false, ImmutableMap.<String, Object>of());
        verify(channel).queueDeclare("orders_wait_1", true, false, false, waitArguments(1000L));
        verify(channel).queueDeclare("orders_wait_2", true, false, false, waitArguments(4000L));
        verify(channel).queueDeclare("orders_wait_3", true, false, false, waitArguments(16000L));
        verify(channel, never()).queueDeclare(eq("orders_wait_4"), eq(true), eq(false), eq(false), anyMap());
    }

    private static ImmutableMap<String, Object> waitArguments(long ttl) {
        return ImmutableMap.<String, Object>of(
                "x-dead-letter-exchange", "",
                "x-dead-letter-routing-key", "orders",
                "x-message-ttl", ttl);
    }

    @Test
    public void existingQueueIsNotRedeclared() throws Exception {
        doReturn(mock(AMQP.Queue.DeclareOk.class)).when(channel).queueDeclarePassive("orders");
        broker.start(ImmutableList.of("orders"));
        verify(channel, never()).queueDeclare(eq("orders"), eq(true), eq(false), eq(false), anyMap());
        verify(channel).queueDeclare(eq("orders_wait_1"), eq(true), eq(false), eq(false), anyMap());
    }

    @Test(expected = AlreadyRunningException.class)
    public void startTwice() throws Exception {
        broker.start(ImmutableList.of());
        broker.start(ImmutableList.of());
    }

    @Test
    public void failedConnectionLeavesBrokerStopped() throws Exception {
        when(factory.newConnection(anyString())).thenThrow(new IOException("connection refused"));
        try {
            broker.start(ImmutableList.of("orders"));
            Assert.fail("start must fail without a connection");
        } catch (QueueBrokerException e) {
            Assert.assertFalse(broker.isRunning());
        }
    }

    @Test(expected = BrokerNotRunningException.class)
    public void publishBeforeStart() throws Exception {
        broker.publish("orders", Message.of("charge"));
    }

    @Test
    public void publishIsPersistentAndConfirmed() throws Exception {
        broker.start(ImmutableList.of("orders"));
        Assert.assertTrue(broker.publish("orders", Message.of("charge").put("order_id", "O1")));

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(channel).confirmSelect();
        verify(channel).basicPublish(eq(""), eq("orders"), properties.capture(), body.capture());
        Assert.assertEquals(Integer.valueOf(2), properties.getValue().getDeliveryMode());
        Assert.assertEquals("application/json", properties.getValue().getContentType());
        Assert.assertEquals("charge", properties.getValue().getType());
        Message sent = codec.decode(body.getValue());
        Assert.assertEquals("O1", sent.get("order_id"));
        Assert.assertEquals(0, sent.getRepeatCount());
        verify(channel).waitForConfirms(10000L);
    }

    @Test
    public void rejectedPublishReturnsFalse() throws Exception {
        when(channel.waitForConfirms(anyLong())).thenReturn(false);
        broker.start(ImmutableList.of("orders"));
        Assert.assertFalse(broker.publish("orders", Message.of("charge")));
    }

    @Test
    public void unconfirmedPublishReturnsFalse() throws Exception {
        when(channel.waitForConfirms(anyLong())).thenThrow(new TimeoutException("no answer"));
        broker.start(ImmutableList.of("orders"));
        Assert.assertFalse(broker.publish("orders", Message.of("charge")));
    }

    @Test
    public void publishFailureIsReported() throws Exception {
        broker.start(ImmutableList.of("orders"));
        doThrow(new IOException("channel closed")).when(channel)
                .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
        try {
            broker.publish("orders", Message.of("charge"));
            Assert.fail("publish must report channel failure");
        } catch (QueueBrokerException e) {
            Assert.assertTrue(e.getCause() instanceof IOException);
        }
    }

    @Test
    public void subscribeUsesManualAckAndPrefetch() throws Exception {
        broker.start(ImmutableList.of("orders"));
        broker.subscribe("orders", m -> HandlerResponse.ok(), SubscribeParams.defaults().prefetch(5));
        verify(channel).basicQos(5);
        verify(channel).basicConsume(eq("orders"), eq(false), any(RabbitConsumer.class));
        Assert.assertEquals(1, broker.listenerCount("orders"));
    }

    @Test(expected = QueueNotFoundException.class)
    public void subscribeToUnknownQueue() throws Exception {
        broker.start(ImmutableList.of());
        broker.subscribe("orders", m -> HandlerResponse.ok(), SubscribeParams.defaults());
    }

    @Test
    public void failedSubscribeIsNotCounted() throws Exception {
        broker.start(ImmutableList.of("orders"));
        when(channel.basicConsume(anyString(), eq(false), any(Consumer.class))).thenThrow(new IOException("access refused"));
        try {
            broker.subscribe("orders", m -> HandlerResponse.ok(), SubscribeParams.defaults());
            Assert.fail("subscribe must report channel failure");
        } catch (QueueBrokerException e) {
            Assert.assertEquals(0, broker.listenerCount("orders"));
        }
        verify(channel).abort();
    }

    @Test
    public void purgeIncludesWaitQueues() throws Exception {
        broker.start(ImmutableList.of("orders"));
        broker.purgeQueue("orders");
        verify(channel).queuePurge("orders");
        verify(channel).queuePurge("orders_wait_1");
        verify(channel).queuePurge("orders_wait_2");
        verify(channel).queuePurge("orders_wait_3");
    }

    @Test
    public void messageCountAsksBroker() throws Exception {
        when(channel.messageCount("orders")).thenReturn(7L);
        broker.start(ImmutableList.of("orders"));
        Assert.assertEquals(7L, broker.messageCount("orders"));
    }

    @Test
    public void deleteRemovesWaitQueuesAndListeners() throws Exception {
        broker.start(ImmutableList.of("orders"));
        broker.subscribe("orders", m -> HandlerResponse.ok(), SubscribeParams.defaults());
        broker.deleteQueue("orders");
        verify(channel).queueDelete("orders");
        verify(channel).queueDelete("orders_wait_1");
        verify(channel).queueDelete("orders_wait_2");
        verify(channel).queueDelete("orders_wait_3");
        Assert.assertEquals(0, broker.listenerCount("orders"));

        broker.createQueue("orders");
        Assert.assertEquals(0, broker.listenerCount("orders"));
    }

    @Test
    public void stopClosesConnection() throws Exception {
        broker.start(ImmutableList.of("orders"));
        broker.stop();
        Assert.assertFalse(broker.isRunning());
        verify(connection).close();
        try {
            broker.publish("orders", Message.of("charge"));
            Assert.fail("publish must fail after stop");
        } catch (BrokerNotRunningException e) {
            Assert.assertTrue(e.getMessage().contains("rabbitmq"));
        }
        verify(channel, never()).queueDelete(anyString());
    }
}
