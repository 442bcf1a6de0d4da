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

/**
 * Options of a single subscription.
 */

public final class SubscribeParams {

    public static final int DEFAULT_PREFETCH = 1;

    private int prefetch = DEFAULT_PREFETCH;

    public static SubscribeParams defaults() {
        return new SubscribeParams();
    }

    /**
     * Maximum number of unacknowledged messages a single consumer may hold. The default of one keeps a busy
     * consumer from sitting on messages an idle consumer could process.
     *
     * @param prefetch in-flight limit, at least one
     * @return params
     */
    public SubscribeParams prefetch(int prefetch) {
        Preconditions.checkArgument(prefetch > 0, "prefetch must be positive");
        this.prefetch = prefetch;
        return this;
    }

    public int getPrefetch() {
        return prefetch;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("prefetch", prefetch).toString();
    }
}
