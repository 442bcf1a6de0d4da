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

import com.google.common.base.Preconditions;
import com.stimulussoft.messagequeue.HandlerResponse;
import com.stimulussoft.messagequeue.Message;
import com.stimulussoft.messagequeue.MessageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches messages of one subscription to its handler and decides what happens to each delivery. This class
 * is for internal use only; the backends feed it messages and carry out the returned {@link Outcome}.
 * <p>
 * Every failure of a single message is contained here. A throwing handler is treated as a retry, a failed
 * requeue is logged, and the consumer keeps running until it receives its quit sentinel.
 * </p>
 */

public class MessageDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(MessageDispatcher.class);

    /**
     * What the backend must do with the delivery that was just dispatched.
     **/

    public enum Outcome {

        /**
         * Handled. Acknowledge.
         **/

        ACK,

        /**
         * A copy was handed to the requeuer. Remove the original from the queue.
         **/

        RETRY,

        /**
         * Rejected for good, either bad data or retries exhausted. Remove without redelivery.
         **/

        DROP,

        /**
         * Quit sentinel. Remove it and stop consuming.
         **/

        STOP
    }

    private final String queueName;
    private final MessageHandler handler;
    private final Backoff backoff;
    private final Requeuer requeuer;
    private volatile DispatchState state = DispatchState.WAITING;

    public MessageDispatcher(String queueName, MessageHandler handler, Backoff backoff, Requeuer requeuer) {
        this.queueName = Preconditions.checkNotNull(queueName, "queue name must be specified");
        this.handler = Preconditions.checkNotNull(handler, "handler must be specified");
        this.backoff = Preconditions.checkNotNull(backoff, "backoff must be specified");
        this.requeuer = Preconditions.checkNotNull(requeuer, "requeuer must be specified");
    }

    /**
     * Dispatch one delivered message.
     *
     * @param message delivered message
     * @return outcome for the delivery
     */

    public Outcome dispatch(Message message) {
        Preconditions.checkState(state != DispatchState.STOPPED, "consumer of queue {%s} is stopped", queueName);
        if (message.isQuit()) {
            logger.info("quitting consumer for queue {}", queueName);
            state = DispatchState.STOPPED;
            return Outcome.STOP;
        }
        state = DispatchState.DISPATCHING;
        try {
            logger.debug("received message {} on queue {}", message, queueName);
            HandlerResponse response = invoke(message);
            switch (response.getStatus()) {
                case OK:
                    logger.debug("message {} processed successfully", message);
                    return Outcome.ACK;
                case RETRY:
                    return attemptRetry(message, response) ? Outcome.RETRY : Outcome.DROP;
                default:
                    logger.debug("rejecting bad data {}: {}", message, response.getMessage().orElse(""));
                    return Outcome.DROP;
            }
        } finally {
            if (state == DispatchState.DISPATCHING)
                state = DispatchState.WAITING;
        }
    }

    private HandlerResponse invoke(Message message) {
        try {
            HandlerResponse response = handler.handle(message);
            return response != null ? response : HandlerResponse.retry("no response from handler");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("processing of message {} was interrupted", message);
            return HandlerResponse.retry("interrupted");
        } catch (Exception e) {
            logger.error("message processing failed for message {}", message, e);
            return HandlerResponse.retry(e.getMessage());
        }
    }

    /**
     * Hand a copy of the message to the requeuer if the retry budget allows.
     *
     * @return true if the copy was handed over, false if the message was given up
     */

    private boolean attemptRetry(Message message, HandlerResponse response) {
        int repeatCount = message.getRepeatCount();
        if (!backoff.isRetryPermitted(repeatCount)) {
            logger.debug("max retries exceeded for processing message {}", message);
            return false;
        }
        int tier = backoff.nextTier(repeatCount);
        Message retry = message.withRepeatCount(tier);
        logger.debug("message {} requeued with response: {}", retry, response.getMessage().orElse(""));
        try {
            if (logger.isDebugEnabled())
                logger.debug("retrying with repeat-count = {} on queue {} with ttl = {}",
                        tier, Backoff.waitQueueName(queueName, tier), backoff.waitQueueTtl(tier));
            requeuer.requeue(queueName, tier, retry);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("requeue of message {} was interrupted", retry, e);
        } catch (Exception e) {
            logger.error("failed to requeue message {}", retry, e);
        }
        return true;
    }

    /**
     * Move to the terminal state without a sentinel, for example when the broker cancels the consumer.
     */

    public void stop() {
        state = DispatchState.STOPPED;
    }

    public DispatchState getState() {
        return state;
    }

    public boolean isStopped() {
        return state == DispatchState.STOPPED;
    }

    public String getQueueName() {
        return queueName;
    }

}
