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

import com.stimulussoft.messagequeue.Message;
import com.stimulussoft.messagequeue.processor.MessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;

/**
 * Repeatedly takes messages off an in-memory queue and dispatches them until a quit sentinel arrives.
 */

final class MemoryConsumer implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(MemoryConsumer.class);

    private final BlockingQueue<Message> queue;
    private final MessageDispatcher dispatcher;
    private final Runnable onStop;

    MemoryConsumer(BlockingQueue<Message> queue, MessageDispatcher dispatcher, Runnable onStop) {
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.onStop = onStop;
    }

    @Override
    public void run() {
        logger.debug("starting consumer for queue {}", dispatcher.getQueueName());
        try {
            while (!dispatcher.isStopped()) {
                Message message = queue.take();
                try {
                    MessageDispatcher.Outcome outcome = dispatcher.dispatch(message);
                    logger.trace("consumer of queue {} finished delivery with {}", dispatcher.getQueueName(), outcome);
                } catch (RuntimeException e) {
                    logger.error("consumer of queue {} dropped message {}", dispatcher.getQueueName(), message, e);
                }
            }
        } catch (InterruptedException e) {
            logger.warn("consumer of queue {} interrupted", dispatcher.getQueueName());
            dispatcher.stop();
            Thread.currentThread().interrupt();
        } finally {
            onStop.run();
        }
    }
}
