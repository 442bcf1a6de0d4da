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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.stimulussoft.messagequeue.Message;
import com.stimulussoft.messagequeue.processor.MessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Delivery callback of one subscription. Acknowledges or rejects each delivery as decided by the
 * {@link MessageDispatcher}. Runs on its own channel with manual acknowledgement.
 */

final class RabbitConsumer extends DefaultConsumer {

    private static final Logger logger = LoggerFactory.getLogger(RabbitConsumer.class);

    private final MessageDispatcher dispatcher;
    private final MessageCodec codec;

    RabbitConsumer(Channel channel, MessageDispatcher dispatcher, MessageCodec codec) {
        super(channel);
        this.dispatcher = dispatcher;
        this.codec = codec;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) throws IOException {
        long deliveryTag = envelope.getDeliveryTag();
        if (dispatcher.isStopped()) {
            // prefetched behind our own quit sentinel, leave it to the remaining consumers
            getChannel().basicNack(deliveryTag, false, true);
            return;
        }
        Message message;
        try {
            message = codec.decode(body);
        } catch (IOException e) {
            logger.error("rejecting unreadable message on queue {}", dispatcher.getQueueName(), e);
            getChannel().basicNack(deliveryTag, false, false);
            return;
        }
        MessageDispatcher.Outcome outcome;
        try {
            outcome = dispatcher.dispatch(message);
        } catch (RuntimeException e) {
            logger.error("rejecting message {} on queue {}", message, dispatcher.getQueueName(), e);
            getChannel().basicNack(deliveryTag, false, false);
            return;
        }
        switch (outcome) {
            case ACK:
            case RETRY:
                getChannel().basicAck(deliveryTag, false);
                break;
            case DROP:
                getChannel().basicNack(deliveryTag, false, false);
                break;
            case STOP:
                getChannel().basicAck(deliveryTag, false);
                getChannel().basicCancel(consumerTag);
                break;
        }
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        logger.info("consumer {} of queue {} stopped", consumerTag, dispatcher.getQueueName());
        dispatcher.stop();
        closeChannel();
    }

    @Override
    public void handleCancel(String consumerTag) {
        logger.info("consumer {} of queue {} cancelled by broker", consumerTag, dispatcher.getQueueName());
        dispatcher.stop();
        closeChannel();
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        if (!sig.isInitiatedByApplication())
            logger.warn("consumer {} of queue {} shut down: {}", consumerTag, dispatcher.getQueueName(), sig.getMessage());
        dispatcher.stop();
    }

    private void closeChannel() {
        try {
            getChannel().abort();
        } catch (IOException e) {
            logger.debug("failed to close channel of queue {}", dispatcher.getQueueName(), e);
        }
    }

    MessageDispatcher getDispatcher() {
        return dispatcher;
    }
}
