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
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import java.util.Map;

/**
 * <p>
 * Queue broker configuration builder
 * </p>
 * <pre>{@code
 * BrokerConfig config = BrokerConfig.config()
 *                         .ttlBase(5000)
 *                         .maxRetries(4)
 *                         .host("rabbit.local").port(5672);
 * }</pre>
 * Values may also be read from the process environment, see {@link #fromEnvironment(Map)}.
 */

public final class BrokerConfig {

    public static final String TTL_BASE_KEY = "MESSAGE_QUEUE_TTL_BASE";
    public static final String MAX_RETRIES_KEY = "MESSAGE_QUEUE_MAX_RETRIES";
    public static final String MEMORY_CAPACITY_KEY = "MESSAGE_QUEUE_MEMORY_CAPACITY";
    public static final String HOST_KEY = "RABBIT_MQ_HOST";
    public static final String PORT_KEY = "RABBIT_MQ_PORT";
    public static final String USERNAME_KEY = "RABBIT_MQ_USERNAME";
    public static final String PASSWORD_KEY = "RABBIT_MQ_PASSWORD";
    public static final String VIRTUAL_HOST_KEY = "RABBIT_MQ_VIRTUAL_HOST";
    public static final String CONFIRM_TIMEOUT_KEY = "RABBIT_MQ_CONFIRM_TIMEOUT";

    public static final long DEFAULT_TTL_BASE = 5000L;
    public static final int DEFAULT_MAX_RETRIES = 4;
    public static final int DEFAULT_MEMORY_CAPACITY = 1000;
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 5672;
    public static final String DEFAULT_USERNAME = "guest";
    public static final String DEFAULT_PASSWORD = "guest";
    public static final String DEFAULT_VIRTUAL_HOST = "/";
    public static final long DEFAULT_CONFIRM_TIMEOUT = 10000L;

    private long ttlBase = DEFAULT_TTL_BASE;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private int memoryCapacity = DEFAULT_MEMORY_CAPACITY;
    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private String username = DEFAULT_USERNAME;
    private String password = DEFAULT_PASSWORD;
    private String virtualHost = DEFAULT_VIRTUAL_HOST;
    private long confirmTimeout = DEFAULT_CONFIRM_TIMEOUT;

    public static BrokerConfig config() {
        return new BrokerConfig();
    }

    /**
     * Read configuration from the process environment.
     *
     * @return config configuration
     */
    public static BrokerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Read configuration from the given variables. Missing, blank or malformed values keep their defaults,
     * negative numbers are clamped to the smallest legal value.
     *
     * @param env environment variables
     * @return config configuration
     */
    public static BrokerConfig fromEnvironment(Map<String, String> env) {
        return config()
                .ttlBase(Math.max(1L, getLong(env, TTL_BASE_KEY, DEFAULT_TTL_BASE)))
                .maxRetries(Math.max(0, getInt(env, MAX_RETRIES_KEY, DEFAULT_MAX_RETRIES)))
                .memoryCapacity(Math.max(1, getInt(env, MEMORY_CAPACITY_KEY, DEFAULT_MEMORY_CAPACITY)))
                .host(getString(env, HOST_KEY, DEFAULT_HOST))
                .port(Math.max(1, getInt(env, PORT_KEY, DEFAULT_PORT)))
                .username(getString(env, USERNAME_KEY, DEFAULT_USERNAME))
                .password(getString(env, PASSWORD_KEY, DEFAULT_PASSWORD))
                .virtualHost(getString(env, VIRTUAL_HOST_KEY, DEFAULT_VIRTUAL_HOST))
                .confirmTimeout(Math.max(0L, getLong(env, CONFIRM_TIMEOUT_KEY, DEFAULT_CONFIRM_TIMEOUT)));
    }

    private static String getString(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return Strings.isNullOrEmpty(value) || value.isBlank() ? defaultValue : value.trim();
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        Integer parsed = Ints.tryParse(getString(env, key, ""));
        return parsed == null ? defaultValue : parsed;
    }

    private static long getLong(Map<String, String> env, String key, long defaultValue) {
        Long parsed = Longs.tryParse(getString(env, key, ""));
        return parsed == null ? defaultValue : parsed;
    }

    /**
     * Base backoff in milliseconds. The wait before retry n is ttlBase * 4^(n-1).
     *
     * @param ttlBase backoff of the first retry in milliseconds
     * @return config configuration
     */
    public BrokerConfig ttlBase(long ttlBase) {
        Preconditions.checkArgument(ttlBase > 0, "ttlBase must be positive");
        this.ttlBase = ttlBase;
        return this;
    }

    public long getTtlBase() {
        return ttlBase;
    }

    /**
     * Maximum number of retries. Zero disables retry.
     *
     * @param maxRetries maximum number of retries
     * @return config configuration
     */
    public BrokerConfig maxRetries(int maxRetries) {
        Preconditions.checkArgument(maxRetries >= 0, "maxRetries can't be less 0");
        this.maxRetries = maxRetries;
        return this;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Capacity of each in-memory queue before publishers block
     *
     * @param memoryCapacity maximum number of queued messages
     * @return config configuration
     */
    public BrokerConfig memoryCapacity(int memoryCapacity) {
        Preconditions.checkArgument(memoryCapacity > 0, "memoryCapacity must be positive");
        this.memoryCapacity = memoryCapacity;
        return this;
    }

    public int getMemoryCapacity() {
        return memoryCapacity;
    }

    public BrokerConfig host(String host) {
        this.host = Preconditions.checkNotNull(host, "host must be specified");
        return this;
    }

    public String getHost() {
        return host;
    }

    public BrokerConfig port(int port) {
        Preconditions.checkArgument(port > 0 && port <= 65535, "invalid port %s", port);
        this.port = port;
        return this;
    }

    public int getPort() {
        return port;
    }

    public BrokerConfig username(String username) {
        this.username = Preconditions.checkNotNull(username, "username must be specified");
        return this;
    }

    public String getUsername() {
        return username;
    }

    public BrokerConfig password(String password) {
        this.password = Preconditions.checkNotNull(password, "password must be specified");
        return this;
    }

    public String getPassword() {
        return password;
    }

    public BrokerConfig virtualHost(String virtualHost) {
        this.virtualHost = Preconditions.checkNotNull(virtualHost, "virtual host must be specified");
        return this;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    /**
     * Time to wait for the broker to confirm a published message. Zero waits forever.
     *
     * @param confirmTimeout confirm timeout in milliseconds
     * @return config configuration
     */
    public BrokerConfig confirmTimeout(long confirmTimeout) {
        Preconditions.checkArgument(confirmTimeout >= 0, "confirmTimeout can't be less 0");
        this.confirmTimeout = confirmTimeout;
        return this;
    }

    public long getConfirmTimeout() {
        return confirmTimeout;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("ttlBase", ttlBase)
                .add("maxRetries", maxRetries)
                .add("memoryCapacity", memoryCapacity)
                .add("host", host)
                .add("port", port)
                .add("username", username)
                .add("virtualHost", virtualHost)
                .add("confirmTimeout", confirmTimeout)
                .toString();
    }
}
