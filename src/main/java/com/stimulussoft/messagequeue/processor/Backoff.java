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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import com.stimulussoft.messagequeue.BrokerConfig;

import java.util.List;

/**
 * Exponential backoff over numbered retry tiers. Tier n is the n-th retry of a message; it waits in the queue
 * {@code <queue>_wait_<n>} for {@code ttlBase * 4^(n-1)} milliseconds. With a base of one second the waits are
 * 1s, 4s, 16s, 64s and so on.
 */

public final class Backoff {

    public static final int GROWTH_FACTOR = 4;
    private static final String WAIT_QUEUE_INFIX = "_wait_";

    private final long ttlBase;
    private final int maxRetries;

    /**
     * @param ttlBase    backoff of the first retry in milliseconds
     * @param maxRetries number of retry tiers
     * @throws IllegalArgumentException if the ttl of the last tier does not fit in a long
     */
    public Backoff(long ttlBase, int maxRetries) {
        Preconditions.checkArgument(ttlBase > 0, "ttlBase must be positive");
        Preconditions.checkArgument(maxRetries >= 0, "maxRetries can't be less 0");
        this.ttlBase = ttlBase;
        this.maxRetries = maxRetries;
        if (maxRetries > 0)
            waitQueueTtl(maxRetries);
    }

    public static Backoff of(BrokerConfig config) {
        return new Backoff(config.getTtlBase(), config.getMaxRetries());
    }

    /**
     * Name of the wait queue for the given tier.
     *
     * @param queueName origin queue
     * @param tier      1-indexed retry tier
     * @return wait queue name
     */
    public static String waitQueueName(String queueName, int tier) {
        Preconditions.checkNotNull(queueName, "queue name must be specified");
        Preconditions.checkArgument(tier >= 1, "tier must be at least 1");
        return queueName + WAIT_QUEUE_INFIX + tier;
    }

    /**
     * Time a message spends in the wait queue of the given tier.
     *
     * @param tier 1-indexed retry tier
     * @return time to live in milliseconds
     * @throws IllegalArgumentException if the tier is below one or the ttl overflows
     */
    public long waitQueueTtl(int tier) {
        Preconditions.checkArgument(tier >= 1, "tier must be at least 1");
        try {
            return LongMath.checkedMultiply(ttlBase, LongMath.checkedPow(GROWTH_FACTOR, tier - 1));
        } catch (ArithmeticException overflow) {
            throw new IllegalArgumentException("wait queue ttl of tier " + tier + " overflows", overflow);
        }
    }

    /**
     * Names of every wait queue of the origin queue, tier 1 first.
     *
     * @param queueName origin queue
     * @return wait queue names, empty when retry is disabled
     */
    public List<String> waitQueueNames(String queueName) {
        ImmutableList.Builder<String> names = ImmutableList.builderWithExpectedSize(maxRetries);
        for (int tier = 1; tier <= maxRetries; tier++)
            names.add(waitQueueName(queueName, tier));
        return names.build();
    }

    public int nextTier(int repeatCount) {
        return repeatCount + 1;
    }

    public boolean isRetryPermitted(int repeatCount) {
        return nextTier(repeatCount) <= maxRetries;
    }

    public long getTtlBase() {
        return ttlBase;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("ttlBase", ttlBase)
                .add("maxRetries", maxRetries)
                .toString();
    }
}
