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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.stimulussoft.messagequeue.Message;

import java.io.IOException;

/**
 * Converts messages to and from their JSON wire form.
 */

public final class MessageCodec {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this(createObjectMapper());
    }

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Preconditions.checkNotNull(objectMapper, "object mapper must be specified");
    }

    /**
     * Create the {@link ObjectMapper} used for serializing.
     *
     * @return the configured {@link ObjectMapper}.
     */
    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public byte[] encode(Message message) throws IOException {
        return objectMapper.writeValueAsBytes(message);
    }

    /**
     * Parse a message body.
     *
     * @param body JSON body
     * @return message
     * @throws IOException if the body is not a JSON object or carries a negative repeat count
     */
    public Message decode(byte[] body) throws IOException {
        if (body == null || body.length == 0)
            throw new IOException("empty message body");
        Message message = objectMapper.readValue(body, Message.class);
        if (message == null)
            throw new IOException("message body is null");
        return message;
    }
}
