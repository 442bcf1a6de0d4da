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

package com.stimulussoft.messagequeue.memory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.stimulussoft.messagequeue.AlreadyRunningException;
import com.stimulussoft.messagequeue.BrokerConfig;
import com.stimulussoft.messagequeue.BrokerNotRunningException;
import com.stimulussoft.messagequeue.Message;
import com.stimulussoft.messagequeue.MessageHandler;
import com.stimulussoft.messagequeue.QueueBroker;
import com.stimulussoft.messagequeue.QueueBrokerException;
import com.stimulussoft.messagequeue.QueueNotFoundException;
import com.stimulussoft.messagequeue.SubscribeParams;
import com.stimulussoft.messagequeue.processor.Backoff;
import com.stimulussoft.messagequeue.processor.MessageDispatcher;
import com.stimulussoft.messagequeue.processor.QueueRecord;
import com.stimulussoft.messagequeue.processor.QueueTable;
import com.stimulussoft.util.ThreadUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory queue broker for single node deployments and tests.
 * <p>
 * Every queue is a bounded FIFO buffer of {@link BrokerConfig#getMemoryCapacity()} messages. {@link #publish}
 * blocks while the buffer is full. Each subscription runs on its own thread and stops when it takes a quit
 * sentinel from its queue.
 * </p>
 * <p>
 * Differences from a durable broker:
 * </p>
 * <ul>
 * <li>Nothing survives the process. {@code publish} returns true as soon as the message is buffered.</li>
 * <li>Retries are put back on the origin queue immediately; the backoff ttl is not honoured.</li>
 * <li>Retries are enqueued through {@link #publishAsync}, which returns before the message is stored. A retry
 * racing with {@link #deleteQueue} may land behind the quit sentinels and is then lost with the queue.</li>
 * <li>{@link SubscribeParams#getPrefetch()} has no effect; a consumer always holds one message at a time.</li>
 * </ul>
 */

public class MemoryQueueBroker implements QueueBroker {

    private static final Logger logger = LoggerFactory.getLogger(MemoryQueueBroker.class);

    private final int queueCapacity;
    private final Backoff backoff;
    private final QueueTable<BlockingQueue<Message>> queues = new QueueTable<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicInteger activeConsumers = new AtomicInteger();
    private final ListeningExecutorService consumerPool = ThreadUtil.newCachedThreadPool("memory-queue-consumer", true);
    private final ListeningExecutorService publisherPool = ThreadUtil.newCachedThreadPool("memory-queue-publisher", true);

    public MemoryQueueBroker(BrokerConfig config) {
        Preconditions.checkNotNull(config, "config must be specified");
        this.queueCapacity = config.getMemoryCapacity();
        this.backoff = Backoff.of(config);
    }

    public MemoryQueueBroker() {
        this(BrokerConfig.config());
    }

    @Override
    public synchronized void start(Collection<String> requiredQueues) throws QueueBrokerException {
        logger.info("starting memory queue");
        if (!running.compareAndSet(false, true))
            throw new AlreadyRunningException("memory");
        try {
            for (String queueName : requiredQueues)
                createQueue(queueName);
        } catch (RuntimeException e) {
            stop();
            throw e;
        }
        logger.debug("required queues created");
    }

    @Override
    public synchronized void stop() throws QueueBrokerException {
        if (!running.get())
            return;
        logger.info("stopping memory queue and removing all queues");
        for (String queueName : queues.names())
            deleteQueue(queueName);
        running.set(false);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void createQueue(String queueName) {
        checkRunning();
        Preconditions.checkNotNull(queueName, "queue name must be specified");
        logger.info("creating queue {}", queueName);
        queues.create(queueName, () -> new LinkedBlockingQueue<>(queueCapacity));
    }

    /**
     * Buffer a message, waiting for space if the queue is full.
     *
     * @return always true
     * @throws QueueBrokerException if interrupted while waiting for space
     */

    @Override
    public boolean publish(String queueName, Message message) throws QueueBrokerException {
        checkRunning();
        Preconditions.checkNotNull(message, "message cannot be null");
        logger.debug("publishing msg {} to queue {}", message, queueName);
        try {
            queue(queueName).put(message.copy());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueBrokerException("interrupted while publishing to queue " + queueName, e);
        }
    }

    /**
     * Buffer a message on a background thread and return at once. The returned future completes once the
     * message is stored, which may be long after this call if the queue is full.
     *
     * @param queueName name of the queue
     * @param message   message to publish
     * @return future completing with true once the message is buffered
     */

    public ListenableFuture<Boolean> publishAsync(String queueName, Message message) {
        checkRunning();
        Preconditions.checkNotNull(message, "message cannot be null");
        logger.debug("publishing msg {} to queue {} in background", message, queueName);
        return enqueueAsync(queueName, queue(queueName), message.copy());
    }

    private ListenableFuture<Boolean> enqueueAsync(String queueName, BlockingQueue<Message> queue, Message message) {
        ListenableFuture<Boolean> stored = publisherPool.submit(() -> {
            queue.put(message);
            return true;
        });
        Futures.addCallback(stored, new FutureCallback<Boolean>() {
            @Override
            public void onSuccess(Boolean result) {
                logger.trace("message {} stored on queue {}", message, queueName);
            }

            @Override
            public void onFailure(@Nonnull Throwable t) {
                logger.error("failed to store message {} on queue {}", message, queueName, t);
            }
        }, MoreExecutors.directExecutor());
        return stored;
    }

    @Override
    public void subscribe(String queueName, MessageHandler handler, SubscribeParams params) throws QueueBrokerException {
        checkRunning();
        Preconditions.checkNotNull(handler, "handler must be specified");
        logger.debug("starting consumer for queue {} with {}", queueName, params);
        int listeners = queues.addListener(queueName, queue -> startConsumer(queueName, queue, handler));
        logger.debug("queue {} has {} listeners", queueName, listeners);
    }

    private void startConsumer(String queueName, BlockingQueue<Message> queue, MessageHandler handler) throws QueueBrokerException {
        // retries go to the buffer this consumer drains, even after the queue has left the table
        MessageDispatcher dispatcher = new MessageDispatcher(queueName, handler, backoff,
                (name, tier, retry) -> enqueueAsync(name, queue, retry));
        activeConsumers.incrementAndGet();
        try {
            consumerPool.execute(new MemoryConsumer(queue, dispatcher, activeConsumers::decrementAndGet));
        } catch (RejectedExecutionException e) {
            activeConsumers.decrementAndGet();
            throw new QueueBrokerException("failed to start consumer for queue " + queueName, e, logger);
        }
    }

    @Override
    public long messageCount(String queueName) {
        checkRunning();
        return queue(queueName).size();
    }

    @Override
    public void purgeQueue(String queueName) {
        checkRunning();
        logger.info("purging all messages from queue {}", queueName);
        queue(queueName).clear();
    }

    /**
     * Remove a queue and its messages. One quit sentinel per listener is put behind the messages still queued, so
     * each consumer finishes the messages ahead of its sentinel before it stops.
     */

    @Override
    public void deleteQueue(String queueName) throws QueueBrokerException {
        checkRunning();
        // a consumer subscribing concurrently is either counted here or fails with QueueNotFoundException
        QueueRecord<BlockingQueue<Message>> record = queues.remove(queueName);
        if (record == null) {
            logger.debug("queue {} does not exist", queueName);
            return;
        }
        logger.info("deleting queue {} with {} listeners", queueName, record.getListeners());
        try {
            for (int i = 0; i < record.getListeners(); i++)
                record.getHandle().put(Message.quit());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueBrokerException("interrupted while stopping consumers of queue " + queueName, e);
        }
    }

    @Override
    public int listenerCount(String queueName) {
        return queues.listenerCount(queueName);
    }

    /**
     * Shut down the consumer and publisher threads. The broker cannot be used afterwards.
     *
     * @throws QueueBrokerException if the broker could not be stopped
     * @throws InterruptedException if interrupted while waiting for threads to finish
     */

    public void destroy() throws QueueBrokerException, InterruptedException {
        stop();
        ThreadUtil.shutdownAndAwaitTermination(publisherPool, 10L, TimeUnit.SECONDS);
        ThreadUtil.shutdownAndAwaitTermination(consumerPool, 10L, TimeUnit.SECONDS);
    }

    @VisibleForTesting
    int activeConsumerCount() {
        return activeConsumers.get();
    }

    private BlockingQueue<Message> queue(String queueName) throws QueueNotFoundException {
        return queues.get(queueName).getHandle();
    }

    private void checkRunning() {
        if (!running.get())
            throw new BrokerNotRunningException("memory");
    }
}
