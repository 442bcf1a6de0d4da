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

import com.google.common.base.MoreObjects;

/**
 * Queue handle together with the number of consumers started on it. Listener counts change only through
 * {@link QueueTable}.
 *
 * @param <H> backend specific queue handle
 */

public final class QueueRecord<H> {

    private final String queueName;
    private final H handle;
    private int listeners;

    QueueRecord(String queueName, H handle) {
        this.queueName = queueName;
        this.handle = handle;
    }

    public String getQueueName() {
        return queueName;
    }

    public H getHandle() {
        return handle;
    }

    public int getListeners() {
        return listeners;
    }

    void incListeners() {
        listeners++;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("queueName", queueName)
                .add("listeners", listeners)
                .toString();
    }
}
