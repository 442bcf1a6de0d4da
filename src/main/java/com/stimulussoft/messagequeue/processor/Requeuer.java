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

import com.stimulussoft.messagequeue.Message;

/**
 * Backend specific half of the retry procedure. Receives a copy of the message whose repeat count already points
 * at the retry tier and arranges for it to reach the origin queue again.
 */

@FunctionalInterface
public interface Requeuer {

    /**
     * Schedule redelivery.
     *
     * @param queueName origin queue
     * @param tier      1-indexed retry tier, equal to the message repeat count
     * @param message   message to redeliver
     * @throws Exception if the message could not be handed over
     */

    void requeue(String queueName, int tier, Message message) throws Exception;

}
