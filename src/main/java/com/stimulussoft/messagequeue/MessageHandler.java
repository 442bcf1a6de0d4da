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

/**
 * Implement this interface to process messages delivered to a subscription. The broker calls
 * {@link #handle(Message)} once per delivered message, on the subscription's own worker.
 */

@FunctionalInterface
public interface MessageHandler {

    /**
     * Handle the given message.
     *
     * @param message message to handle
     * @return {@code OK} when done, {@code RETRY} for a transient failure, {@code FAIL} for bad data
     * @throws Exception any exception is treated as {@code RETRY} with the exception message
     */

    HandlerResponse handle(Message message) throws Exception;

}
