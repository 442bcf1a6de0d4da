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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unit of work travelling through a queue.
 * <p>
 * A message carries an {@code action} that tells the handler what to do, the number of retries already made
 * ({@code repeatCount}) and any number of caller defined fields. Caller fields are serialized next to
 * {@code action} and {@code repeat-count} in the JSON body and survive every retry untouched.
 * </p>
 * <pre>{@code
 * Message message = Message.of("index-concept")
 *                          .put("concept-id", "C1-PROV1")
 *                          .put("revision-id", 1);
 * broker.publish("ingest", message);
 * }</pre>
 */

public class Message implements Serializable {

    /**
     * Reserved action of the shutdown sentinel.
     */
    public static final String QUIT_ACTION = "quit";

    static final String ACTION_FIELD = "action";
    static final String REPEAT_COUNT_FIELD = "repeat-count";

    private String action;
    private int repeatCount;
    private final Map<String, Object> payload = new LinkedHashMap<>();

    public Message() {
    }

    public Message(String action) {
        this.action = action;
    }

    public static Message of(String action) {
        return new Message(action);
    }

    /**
     * Sentinel telling exactly one consumer of a queue to stop.
     *
     * @return new quit message
     */
    public static Message quit() {
        return new Message(QUIT_ACTION);
    }

    @JsonProperty(ACTION_FIELD)
    public String getAction() {
        return action;
    }

    @JsonProperty(ACTION_FIELD)
    public void setAction(String action) {
        this.action = action;
    }

    @JsonProperty(REPEAT_COUNT_FIELD)
    public int getRepeatCount() {
        return repeatCount;
    }

    @JsonProperty(REPEAT_COUNT_FIELD)
    public void setRepeatCount(int repeatCount) {
        Preconditions.checkArgument(repeatCount >= 0, "repeatCount can't be less 0");
        this.repeatCount = repeatCount;
    }

    @JsonAnyGetter
    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    /**
     * Set a payload field. The envelope fields {@code action} and {@code repeat-count} are set on the message
     * itself and never enter the payload.
     *
     * @param field field name
     * @param value field value
     * @return this message
     * @throws IllegalArgumentException if {@code repeat-count} is not a non-negative integer
     */
    @JsonAnySetter
    public Message put(String field, Object value) {
        Preconditions.checkNotNull(field, "field name cannot be null");
        switch (field) {
            case ACTION_FIELD:
                setAction(value == null ? null : value.toString());
                break;
            case REPEAT_COUNT_FIELD:
                Preconditions.checkArgument(value instanceof Integer || value instanceof Long || value instanceof Short,
                        "repeat-count must be an integer, got %s", value);
                setRepeatCount(Ints.checkedCast(((Number) value).longValue()));
                break;
            default:
                payload.put(field, value);
        }
        return this;
    }

    public Object get(String field) {
        return payload.get(field);
    }

    @JsonIgnore
    public boolean isQuit() {
        return QUIT_ACTION.equals(action);
    }

    /**
     * Copy of this message. The payload map is copied, the values are shared.
     *
     * @return independent copy
     */
    public Message copy() {
        Message copy = new Message(action);
        copy.repeatCount = repeatCount;
        copy.payload.putAll(payload);
        return copy;
    }

    /**
     * Copy of this message with a different retry count.
     *
     * @param repeatCount retries already made
     * @return independent copy
     */
    public Message withRepeatCount(int repeatCount) {
        Message copy = copy();
        copy.setRepeatCount(repeatCount);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message that = (Message) o;
        return repeatCount == that.repeatCount
                && Objects.equals(action, that.action)
                && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, repeatCount, payload);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("action", action)
                .add("repeatCount", repeatCount)
                .add("payload", payload)
                .toString();
    }
}
