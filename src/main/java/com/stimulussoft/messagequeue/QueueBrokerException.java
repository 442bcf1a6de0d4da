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

import org.slf4j.Logger;

/**
 * General broker exception. Raised when the underlying queue transport fails, for example when the
 * connection to the message broker is lost.
 */

public class QueueBrokerException extends Exception {

    public QueueBrokerException(String message, Logger logger) {
        super(message);
        logger.error(message);
    }

    public QueueBrokerException(String message, Throwable cause) {
        super(message, cause);
    }

    public QueueBrokerException(String message, Throwable cause, Logger logger) {
        super(message, cause);
        logger.error(message, cause);
    }

    public QueueBrokerException(String message) {
        super(message);
    }

}
