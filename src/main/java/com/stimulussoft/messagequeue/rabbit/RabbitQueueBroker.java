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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.stimulussoft.messagequeue.AlreadyRunningException;
import com.stimulussoft.messagequeue.BrokerConfig;
import com.stimulussoft.messagequeue.BrokerNotRunningException;
import com.stimulussoft.messagequeue.Message;
import com.stimulussoft.messagequeue.MessageHandler;
import com.stimulussoft.messagequeue.QueueBroker;
import com.stimulussoft.messagequeue.QueueBrokerException;
import com.stimulussoft.messagequeue.SubscribeParams;
import com.stimulussoft.messagequeue.processor.Backoff;
import com.stimulussoft.messagequeue.processor.MessageDispatcher;
import com.stimulussoft.messagequeue.processor.QueueRecord;
import com.stimulussoft.messagequeue.processor.QueueTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue broker backed by RabbitMQ.
 * <p>
 * Every queue is a durable RabbitMQ queue accompanied by one wait queue per retry tier. A wait queue has no
 * consumers; its message ttl is the backoff of its tier and its dead letter route points back at the origin queue,
 * so RabbitMQ itself moves a retried message back once the backoff has elapsed.
 * </p>
 * <pre>
 * orders          &lt;-----------------------------+
 *   | retry, repeat-count 0 -&gt; 1                |  dead letter after ttlBase
 *   +--&gt; orders_wait_1 -------------------------+
 *   | retry, repeat-count 1 -&gt; 2                |  dead letter after ttlBase * 4
 *   +--&gt; orders_wait_2 -------------------------+
 * </pre>
 * <p>
 * Messages are published persistent on the default exchange with publisher confirms; {@link #publish} returns
 * the broker's answer. Queue contents outlive {@link #stop()}.
 * </p>
 */

public class RabbitQueueBroker implements QueueBroker {

    private static final Logger logger = LoggerFactory.getLogger(RabbitQueueBroker.class);

    public static final String DEFAULT_EXCHANGE_NAME = "";
    private static final int PERSISTENT_DELIVERY_MODE = 2;

    private final ConnectionFactory connectionFactory;
    private final MessageCodec codec;
    private final Backoff backoff;
    private final long confirmTimeout;
    private final QueueTable<String> queues = new QueueTable<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile Connection connection;

    public RabbitQueueBroker(BrokerConfig config) {
        this(config, connectionFactory(config), new MessageCodec());
    }

    public RabbitQueueBroker(BrokerConfig config, ConnectionFactory connectionFactory, MessageCodec codec) {
        Preconditions.checkNotNull(config, "config must be specified");
        this.connectionFactory = Preconditions.checkNotNull(connectionFactory, "connection factory must be specified");
        this.codec = Preconditions.checkNotNull(codec, "codec must be specified");
        this.backoff = Backoff.of(config);
        this.confirmTimeout = config.getConfirmTimeout();
    }

    static ConnectionFactory connectionFactory(BrokerConfig config) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getHost());
        factory.setPort(config.getPort());
        factory.setUsername(config.getUsername());
        factory.setPassword(config.getPassword());
        factory.setVirtualHost(config.getVirtualHost());
        return factory;
    }

    @Override
    public synchronized void start(Collection<String> requiredQueues) throws QueueBrokerException {
        logger.info("starting RabbitMQ connection");
        if (running.get())
            throw new AlreadyRunningException("rabbitmq");
        try {
            connection = connectionFactory.newConnection("messagequeue");
        } catch (IOException | TimeoutException e) {
            throw new QueueBrokerException("failed to connect to RabbitMQ", e, logger);
        }
        running.set(true);
        logger.debug("connection started");
        try {
            for (String queueName : requiredQueues)
                createQueue(queueName);
        } catch (QueueBrokerException | RuntimeException e) {
            stop();
            throw e;
        }
        logger.debug("required queues created");
    }

    /**
     * Close the connection. Closing the connection closes every channel and with it every consumer. Messages
     * stay on the broker.
     */

    @Override
    public synchronized void stop() throws QueueBrokerException {
        if (!running.compareAndSet(true, false))
            return;
        logger.info("stopping RabbitMQ connection");
        for (String queueName : queues.names())
            queues.remove(queueName);
        try {
            if (connection.isOpen())
                connection.close();
        } catch (IOException e) {
            throw new QueueBrokerException("failed to close RabbitMQ connection", e, logger);
        } finally {
            connection = null;
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void createQueue(String queueName) throws QueueBrokerException {
        Connection connection = checkRunning();
        Preconditions.checkNotNull(queueName, "queue name must be specified");
        logger.info("creating queue {}", queueName);
        try {
            safeCreateQueue(connection, queueName, ImmutableMap.<String, Object>of());
            logger.info("creating wait queues");
            for (int tier = 1; tier <= backoff.getMaxRetries(); tier++) {
                String waitQueue = Backoff.waitQueueName(queueName, tier);
                logger.debug("creating wait queue {}", waitQueue);
                safeCreateQueue(connection, waitQueue, waitQueueArguments(queueName, tier));
            }
        } catch (IOException | TimeoutException e) {
            throw new QueueBrokerException("failed to create queue " + queueName, e, logger);
        }
        queues.create(queueName, () -> queueName);
    }

    Map<String, Object> waitQueueArguments(String queueName, int tier) {
        return ImmutableMap.<String, Object>of(
                "x-dead-letter-exchange", DEFAULT_EXCHANGE_NAME,
                "x-dead-letter-routing-key", queueName,
                "x-message-ttl", backoff.waitQueueTtl(tier));
    }

    private void safeCreateQueue(Connection connection, String queueName, Map<String, Object> arguments) throws IOException, TimeoutException {
        if (queueExists(connection, queueName)) {
            logger.info("queue {} already exists", queueName);
            return;
        }
        try (Channel channel = connection.createChannel()) {
            channel.queueDeclare(queueName, true, false, false, arguments);
        }
        logger.info("created queue {}", queueName);
    }

    /**
     * A passive declare fails with a channel error when the queue does not exist, which closes the channel. The
     * probe therefore runs on a channel of its own.
     */

    private boolean queueExists(Connection connection, String queueName) throws IOException, TimeoutException {
        Channel channel = connection.createChannel();
        try {
            channel.queueDeclarePassive(queueName);
            return true;
        } catch (IOException notFound) {
            logger.trace("queue {} not found: {}", queueName, notFound.getMessage());
            return false;
        } finally {
            if (channel.isOpen())
                channel.close();
        }
    }

    /**
     * Publish a persistent message and wait for the broker to confirm it.
     *
     * @return true if confirmed, false if the broker rejected the message or did not answer in time
     */

    @Override
    public boolean publish(String queueName, Message message) throws QueueBrokerException {
        Connection connection = checkRunning();
        Preconditions.checkNotNull(message, "message cannot be null");
        logger.debug("publishing msg {} to queue {}", message, queueName);
        try (Channel channel = connection.createChannel()) {
            channel.confirmSelect();
            channel.basicPublish(DEFAULT_EXCHANGE_NAME, queueName, properties(message), codec.encode(message));
            return waitForConfirms(channel, queueName);
        } catch (IOException | TimeoutException e) {
            throw new QueueBrokerException("failed to publish to queue " + queueName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueBrokerException("interrupted while publishing to queue " + queueName, e);
        }
    }

    private AMQP.BasicProperties properties(Message message) {
        return new AMQP.BasicProperties.Builder()
                .contentType(MessageCodec.CONTENT_TYPE)
                .deliveryMode(PERSISTENT_DELIVERY_MODE)
                .type(message.getAction())
                .build();
    }

    private boolean waitForConfirms(Channel channel, String queueName) throws InterruptedException {
        try {
            boolean confirmed = confirmTimeout > 0 ? channel.waitForConfirms(confirmTimeout) : channel.waitForConfirms();
            if (!confirmed)
                logger.warn("broker rejected message published to queue {}", queueName);
            return confirmed;
        } catch (TimeoutException e) {
            logger.warn("message published to queue {} not confirmed within {} ms", queueName, confirmTimeout);
            return false;
        }
    }

    @Override
    public void subscribe(String queueName, MessageHandler handler, SubscribeParams params) throws QueueBrokerException {
        Connection connection = checkRunning();
        Preconditions.checkNotNull(handler, "handler must be specified");
        int listeners = queues.addListener(queueName, queue -> startConsumer(connection, queue, handler, params));
        logger.debug("queue {} has {} listeners", queueName, listeners);
    }

    private void startConsumer(Connection connection, String queueName, MessageHandler handler, SubscribeParams params) throws QueueBrokerException {
        Channel channel = null;
        try {
            channel = connection.createChannel();
            logger.debug("setting channel prefetch to {}", params.getPrefetch());
            channel.basicQos(params.getPrefetch());
            MessageDispatcher dispatcher = new MessageDispatcher(queueName, handler, backoff, this::requeue);
            String consumerTag = channel.basicConsume(queueName, false, new RabbitConsumer(channel, dispatcher, codec));
            logger.debug("consumer {} subscribed to queue {}", consumerTag, queueName);
        } catch (IOException e) {
            if (channel != null)
                abort(channel, e);
            throw new QueueBrokerException("failed to subscribe to queue " + queueName, e, logger);
        }
    }

    private static void abort(Channel channel, IOException cause) {
        try {
            channel.abort();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Park a retried message in the wait queue of its tier.
     */

    void requeue(String queueName, int tier, Message message) throws QueueBrokerException {
        String waitQueue = Backoff.waitQueueName(queueName, tier);
        if (!publish(waitQueue, message))
            throw new QueueBrokerException("retry of message " + message + " was not confirmed by " + waitQueue);
    }

    @Override
    public long messageCount(String queueName) throws QueueBrokerException {
        Connection connection = checkRunning();
        try (Channel channel = connection.createChannel()) {
            logger.debug("getting message count for queue {}", queueName);
            return channel.messageCount(queueName);
        } catch (IOException | TimeoutException e) {
            throw new QueueBrokerException("failed to count messages of queue " + queueName, e);
        }
    }

    @Override
    public void purgeQueue(String queueName) throws QueueBrokerException {
        Connection connection = checkRunning();
        try (Channel channel = connection.createChannel()) {
            logger.info("purging all messages from queue {}", queueName);
            channel.queuePurge(queueName);
            for (String waitQueue : backoff.waitQueueNames(queueName)) {
                logger.debug("purging messages from wait queue {}", waitQueue);
                channel.queuePurge(waitQueue);
            }
        } catch (IOException | TimeoutException e) {
            throw new QueueBrokerException("failed to purge queue " + queueName, e, logger);
        }
    }

    /**
     * Delete the queue and its wait queues from the broker. RabbitMQ cancels every consumer of a deleted queue;
     * the cancel notification is the termination signal of each subscription.
     */

    @Override
    public void deleteQueue(String queueName) throws QueueBrokerException {
        Connection connection = checkRunning();
        QueueRecord<String> record = queues.remove(queueName);
        logger.info("deleting queue {} with {} listeners", queueName, record == null ? 0 : record.getListeners());
        try (Channel channel = connection.createChannel()) {
            channel.queueDelete(queueName);
            for (String waitQueue : backoff.waitQueueNames(queueName)) {
                logger.debug("deleting wait queue {}", waitQueue);
                channel.queueDelete(waitQueue);
            }
        } catch (IOException | TimeoutException e) {
            throw new QueueBrokerException("failed to delete queue " + queueName, e, logger);
        }
    }

    @Override
    public int listenerCount(String queueName) {
        return queues.listenerCount(queueName);
    }

    private Connection checkRunning() {
        Connection current = connection;
        if (!running.get() || current == null)
            throw new BrokerNotRunningException("rabbitmq");
        return current;
    }
}
