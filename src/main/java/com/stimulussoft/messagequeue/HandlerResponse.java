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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of handling a single message.
 */

public final class HandlerResponse {

    /**
     * Result of handling.
     **/

    public enum Status {

        /**
         * Processing of message was successful. Do not requeue.
         **/

        OK,

        /**
         * Processing of message failed, however retry later.
         **/

        RETRY,

        /**
         * Processing of message failed permanently (bad data). No retry.
         **/

        FAIL
    }

    private static final HandlerResponse OK = new HandlerResponse(Status.OK, null);

    private final Status status;
    private final String message;

    private HandlerResponse(Status status, String message) {
        this.status = Preconditions.checkNotNull(status, "status cannot be null");
        this.message = message;
    }

    public static HandlerResponse ok() {
        return OK;
    }

    public static HandlerResponse retry(String message) {
        return new HandlerResponse(Status.RETRY, message);
    }

    public static HandlerResponse fail(String message) {
        return new HandlerResponse(Status.FAIL, message);
    }

    public Status getStatus() {
        return status;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HandlerResponse)) return false;
        HandlerResponse that = (HandlerResponse) o;
        return status == that.status && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, message);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("status", status)
                .add("message", message)
                .toString();
    }
}
