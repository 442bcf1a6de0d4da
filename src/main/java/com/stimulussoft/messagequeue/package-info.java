/**
 * The MessageQueue project offers one queueing abstraction, {@link com.stimulussoft.messagequeue.QueueBroker},
 * with two interchangeable backends: an in-memory broker for single node use and tests, and a RabbitMQ broker for
 * production. Producers publish {@link com.stimulussoft.messagequeue.Message}s to named queues; subscriptions hand
 * each message to a {@link com.stimulussoft.messagequeue.MessageHandler}.
 * <p>
 * A handler answers OK, RETRY or FAIL. Retried messages are redelivered with exponential backoff: the n-th retry
 * waits ttlBase * 4^(n-1) milliseconds in the wait queue {@code <queue>_wait_<n>} before it returns to its queue.
 * Once the configured number of retries is spent the message is dropped. FAIL drops a message at once.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this project except in compliance with the License. You may obtain a copy of the License at http://www.apache.org/licenses/LICENSE-2.0.
 *
 * @see com.stimulussoft.messagequeue
 * @since 1.0
 */
package com.stimulussoft.messagequeue;
