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

package com.stimulussoft.messagequeue;

import java.util.Collection;

/**
 * Queue broker. Owns a set of named queues, publishes messages to them and runs subscriptions that hand each
 * message to a {@link MessageHandler}. Messages a handler asks to retry are redelivered with exponential backoff
 * until the configured retry budget is spent.
 * <p>
 * Two implementations are provided. {@code MemoryQueueBroker} keeps everything in process and retries without
 * delay. {@code RabbitQueueBroker} keeps queues on a RabbitMQ server and lets the server honour the backoff
 * through per-tier wait queues.
 * </p>
 * <pre>{@code
 * QueueBroker broker = new MemoryQueueBroker(BrokerConfig.fromEnvironment());
 * broker.start(List.of("ingest"));
 * broker.subscribe("ingest", message -> HandlerResponse.ok(), SubscribeParams.defaults());
 * broker.publish("ingest", Message.of("index-concept").put("concept-id", "C1-PROV1"));
 * // when finished
 * broker.stop();
 * }</pre>
 * Every data plane operation throws {@link BrokerNotRunningException} while the broker is stopped.
 */

public interface QueueBroker {

    /**
     * Start the broker and create the given queues.
     *
     * @param requiredQueues queues that must exist once started
     * @throws AlreadyRunningException if the broker is already running
     * @throws QueueBrokerException    if the broker could not be reached
     */

    void start(Collection<String> requiredQueues) throws QueueBrokerException;

    /**
     * Stop the broker. Every subscription is terminated. Does nothing if the broker is not running.
     *
     * @throws QueueBrokerException if the broker could not be shut down cleanly
     */

    void stop() throws QueueBrokerException;

    boolean isRunning();

    /**
     * Create a queue. Creating an existing queue has no effect.
     *
     * @param queueName name of the queue
     * @throws QueueBrokerException if the queue could not be created
     */

    void createQueue(String queueName) throws QueueBrokerException;

    /**
     * Publish a message.
     *
     * @param queueName name of the queue
     * @param message   message to publish
     * @return true if the broker accepted the message. Backends without delivery confirmation always return true.
     * @throws QueueBrokerException if the message could not be handed to the broker
     */

    boolean publish(String queueName, Message message) throws QueueBrokerException;

    /**
     * Start one new consumer of the given queue. Returns without waiting for any message. Call repeatedly to add
     * consumers.
     *
     * @param queueName name of the queue
     * @param handler   callback processing each message
     * @param params    subscription options
     * @throws QueueNotFoundException if the queue was not created
     * @throws QueueBrokerException   if the consumer could not be registered
     */

    void subscribe(String queueName, MessageHandler handler, SubscribeParams params) throws QueueBrokerException;

    /**
     * Number of messages waiting for delivery. Advisory only, it may change while it is being read.
     *
     * @param queueName name of the queue
     * @return no queued messages
     * @throws QueueBrokerException if the count could not be read
     */

    long messageCount(String queueName) throws QueueBrokerException;

    /**
     * Discard every queued message of the queue and its wait queues. The queue and its consumers remain.
     *
     * @param queueName name of the queue
     * @throws QueueBrokerException if the queue could not be purged
     */

    void purgeQueue(String queueName) throws QueueBrokerException;

    /**
     * Remove the queue and its wait queues, then stop every consumer recorded for it.
     *
     * @param queueName name of the queue
     * @throws QueueBrokerException if the queue could not be deleted
     */

    void deleteQueue(String queueName) throws QueueBrokerException;

    /**
     * Number of consumers currently recorded for the queue.
     *
     * @param queueName name of the queue
     * @return listener count, zero for an unknown queue
     */

    int listenerCount(String queueName);

}
