package com.questrail.groupchat.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for one mesh node.
 *
 * <p>Shared defaults can come from a {@code group-chat.properties} file on the
 * classpath; each agent then overrides its own name and port on the builder.</p>
 *
 * @param agentName        identity written into every outgoing message
 * @param host             bind and dial host
 * @param port             this node's listening port, the centre of the discovery window
 * @param discoveryRange   discovery scans {@code port - range .. port + range}, excluding {@code port}
 * @param queueCapacity    inbound queue capacity; messages beyond it are dropped
 * @param maxMessageLength outgoing text is truncated to this many characters
 * @param timingPolicy     operational timing
 */
public record GroupChatConfig(
        String agentName,
        String host,
        int port,
        int discoveryRange,
        int queueCapacity,
        int maxMessageLength,
        GroupChatTimingPolicy timingPolicy
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 54321;
    public static final int DEFAULT_DISCOVERY_RANGE = 5;
    public static final int DEFAULT_QUEUE_CAPACITY = 100;
    public static final int DEFAULT_MAX_MESSAGE_LENGTH = 5000;

    public static final String DEFAULT_RESOURCE = "group-chat.properties";

    static final String KEY_PREFIX = "group-chat.";

    public GroupChatConfig {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timingPolicy, "timingPolicy");

        if (agentName.isBlank()) {
            throw new IllegalArgumentException("agentName must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535");
        }
        if (discoveryRange < 1) {
            throw new IllegalArgumentException("discoveryRange must be >= 1");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (maxMessageLength < 1) {
            throw new IllegalArgumentException("maxMessageLength must be >= 1");
        }
    }

    public InetSocketAddress bindAddress() {
        return new InetSocketAddress(host, port);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-populated from {@value #DEFAULT_RESOURCE} when that resource
     * is on the classpath, plain defaults otherwise.
     */
    public static Builder defaultsFromClasspath() {
        Builder builder = builder();
        ClassLoader loader = GroupChatConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                Properties properties = new Properties();
                properties.load(in);
                builder.applyProperties(properties);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
        return builder;
    }

    public static GroupChatConfig fromProperties(Properties properties) {
        return builder().applyProperties(properties).build();
    }

    public static final class Builder {
        private String agentName;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int discoveryRange = DEFAULT_DISCOVERY_RANGE;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private int maxMessageLength = DEFAULT_MAX_MESSAGE_LENGTH;
        private GroupChatTimingPolicy timingPolicy = GroupChatTimingPolicy.defaults();

        public Builder withAgentName(String agentName) {
            this.agentName = agentName;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withDiscoveryRange(int range) {
            this.discoveryRange = range;
            return this;
        }

        public Builder withQueueCapacity(int capacity) {
            this.queueCapacity = capacity;
            return this;
        }

        public Builder withMaxMessageLength(int length) {
            this.maxMessageLength = length;
            return this;
        }

        public Builder withTimingPolicy(GroupChatTimingPolicy policy) {
            this.timingPolicy = policy;
            return this;
        }

        /**
         * Overlay {@code group-chat.*} keys. Keys that are absent keep their
         * current value. Durations are given in milliseconds.
         *
         * @throws IllegalArgumentException if a numeric key does not parse
         */
        public Builder applyProperties(Properties properties) {
            Objects.requireNonNull(properties, "properties");

            agentName = string(properties, "agent-name", agentName);
            host = string(properties, "host", host);
            port = integer(properties, "port", port);
            discoveryRange = integer(properties, "discovery-range", discoveryRange);
            queueCapacity = integer(properties, "queue-capacity", queueCapacity);
            maxMessageLength = integer(properties, "max-message-length", maxMessageLength);

            GroupChatTimingPolicy t = timingPolicy;
            timingPolicy = new GroupChatTimingPolicy(
                    millis(properties, "connect-timeout-ms", t.connectTimeout()),
                    millis(properties, "second-pass-delay-ms", t.secondPassDelay()),
                    millis(properties, "warmup-window-ms", t.warmupWindow()),
                    millis(properties, "warmup-discovery-interval-ms", t.warmupDiscoveryInterval()),
                    millis(properties, "steady-discovery-interval-ms", t.steadyDiscoveryInterval()),
                    millis(properties, "injector-interval-ms", t.injectorInterval()),
                    millis(properties, "broadcast-timeout-ms", t.broadcastTimeout())
            );
            return this;
        }

        public GroupChatConfig build() {
            return new GroupChatConfig(agentName, host, port, discoveryRange,
                    queueCapacity, maxMessageLength, timingPolicy);
        }

        private static String string(Properties p, String key, String fallback) {
            String value = p.getProperty(KEY_PREFIX + key);
            return value == null || value.isBlank() ? fallback : value.trim();
        }

        private static int integer(Properties p, String key, int fallback) {
            String value = p.getProperty(KEY_PREFIX + key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + KEY_PREFIX + key + ": " + value, e);
            }
        }

        private static Duration millis(Properties p, String key, Duration fallback) {
            String value = p.getProperty(KEY_PREFIX + key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            try {
                return Duration.ofMillis(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + KEY_PREFIX + key + ": " + value, e);
            }
        }
    }
}
