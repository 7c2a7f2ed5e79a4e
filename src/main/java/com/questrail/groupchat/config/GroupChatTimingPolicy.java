package com.questrail.groupchat.config;

import java.time.Duration;
import java.util.Objects;

/**
 * GroupChatTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for a mesh node.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: Per-attempt limit for an outbound discovery
 *       connect. Kept sub-second so a full scan of the window stays short.</li>
 *   <li><b>secondPassDelay</b>: Pause between the two startup discovery
 *       passes. Catches peers that are binding at the same moment.</li>
 *   <li><b>warmupWindow</b>: Time after start during which discovery runs on
 *       the short interval.</li>
 *   <li><b>warmupDiscoveryInterval</b>: Discovery interval inside the warm-up
 *       window.</li>
 *   <li><b>steadyDiscoveryInterval</b>: Discovery interval after the warm-up
 *       window.</li>
 *   <li><b>injectorInterval</b>: Pause between two drains of the inbound
 *       queue.</li>
 *   <li><b>broadcastTimeout</b>: How long a synchronous broadcast caller waits
 *       for the event loop to report the outcome.</li>
 * </ul>
 */
public record GroupChatTimingPolicy(
        Duration connectTimeout,
        Duration secondPassDelay,
        Duration warmupWindow,
        Duration warmupDiscoveryInterval,
        Duration steadyDiscoveryInterval,
        Duration injectorInterval,
        Duration broadcastTimeout
) {
    public GroupChatTimingPolicy {
        requirePositive(connectTimeout, "connectTimeout");
        requireNonNegative(secondPassDelay, "secondPassDelay");
        requireNonNegative(warmupWindow, "warmupWindow");
        requirePositive(warmupDiscoveryInterval, "warmupDiscoveryInterval");
        requirePositive(steadyDiscoveryInterval, "steadyDiscoveryInterval");
        requirePositive(injectorInterval, "injectorInterval");
        requirePositive(broadcastTimeout, "broadcastTimeout");
    }

    /**
     * Default values:
     * <ul>
     *   <li>connectTimeout: 500ms</li>
     *   <li>secondPassDelay: 500ms</li>
     *   <li>warmupWindow: 30s</li>
     *   <li>warmupDiscoveryInterval: 5s</li>
     *   <li>steadyDiscoveryInterval: 30s</li>
     *   <li>injectorInterval: 500ms</li>
     *   <li>broadcastTimeout: 1s</li>
     * </ul>
     */
    public static GroupChatTimingPolicy defaults() {
        return new GroupChatTimingPolicy(
                Duration.ofMillis(500),
                Duration.ofMillis(500),
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30),
                Duration.ofMillis(500),
                Duration.ofSeconds(1)
        );
    }

    /**
     * Discovery interval that applies once {@code sinceStart} has elapsed
     * since the node started.
     */
    public Duration discoveryIntervalAfter(Duration sinceStart) {
        Objects.requireNonNull(sinceStart, "sinceStart");
        return sinceStart.compareTo(warmupWindow) < 0
                ? warmupDiscoveryInterval
                : steadyDiscoveryInterval;
    }

    /**
     * Upper bound for one full discovery scan of a window of {@code ports}
     * ports, with one second of slack.
     */
    public Duration scanBudget(int ports) {
        return connectTimeout.multipliedBy(Math.max(ports, 1)).plusSeconds(1);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
