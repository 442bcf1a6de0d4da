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

package com.stimulussoft.messagequeue.processor;

import com.google.common.collect.ImmutableSet;
import com.stimulussoft.messagequeue.QueueBrokerException;
import com.stimulussoft.messagequeue.QueueNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Queues known to a broker. All structural changes, including the registration of a new consumer, are
 * serialized on this table. A consumer is therefore either registered before a queue is removed, and counted in
 * the record returned by {@link #remove(String)}, or its subscription fails with {@link QueueNotFoundException}.
 *
 * @param <H> backend specific queue handle
 */

public final class QueueTable<H> {

    /**
     * Starts a consumer on a queue handle while the table is locked.
     **/

    @FunctionalInterface
    public interface Registration<H> {

        void register(H handle) throws QueueBrokerException;
    }

    private final Map<String, QueueRecord<H>> records = new LinkedHashMap<>();

    /**
     * Add a queue if it is not known yet.
     *
     * @param queueName name of the queue
     * @param handle    creates the handle of a new queue
     * @return record of the queue, existing or new
     */
    public synchronized QueueRecord<H> create(String queueName, Supplier<H> handle) {
        return records.computeIfAbsent(queueName, name -> new QueueRecord<>(name, handle.get()));
    }

    public synchronized QueueRecord<H> get(String queueName) throws QueueNotFoundException {
        QueueRecord<H> record = records.get(queueName);
        if (record == null)
            throw new QueueNotFoundException(queueName);
        return record;
    }

    public synchronized boolean contains(String queueName) {
        return records.containsKey(queueName);
    }

    /**
     * Start a consumer through the given registration and count it as a listener of the queue. The listener is
     * counted only if the registration succeeds.
     *
     * @param queueName    name of the queue
     * @param registration starts the consumer
     * @return listener count after registration
     * @throws QueueNotFoundException if the queue is not in the table
     * @throws QueueBrokerException   if the registration failed
     */
    public synchronized int addListener(String queueName, Registration<H> registration) throws QueueBrokerException {
        QueueRecord<H> record = get(queueName);
        registration.register(record.getHandle());
        record.incListeners();
        return record.getListeners();
    }

    public synchronized int listenerCount(String queueName) {
        QueueRecord<H> record = records.get(queueName);
        return record == null ? 0 : record.getListeners();
    }

    /**
     * Remove a queue. The returned record is detached from the table; its listener count is the count at the
     * moment of removal and no longer changes.
     *
     * @param queueName name of the queue
     * @return removed record, or null for an unknown queue
     */
    public synchronized QueueRecord<H> remove(String queueName) {
        return records.remove(queueName);
    }

    public synchronized Set<String> names() {
        return ImmutableSet.copyOf(records.keySet());
    }

    public synchronized int size() {
        return records.size();
    }
}
