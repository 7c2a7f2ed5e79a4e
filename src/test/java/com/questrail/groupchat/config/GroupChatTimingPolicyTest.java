package com.questrail.groupchat.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GroupChatTimingPolicyTest
 * -----------------------------------------------------------------------------
 * Defaults, validation and the adaptive discovery interval.
 */
class GroupChatTimingPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        GroupChatTimingPolicy policy = GroupChatTimingPolicy.defaults();

        assertEquals(Duration.ofMillis(500), policy.connectTimeout());
        assertEquals(Duration.ofMillis(500), policy.secondPassDelay());
        assertEquals(Duration.ofSeconds(30), policy.warmupWindow());
        assertEquals(Duration.ofSeconds(5), policy.warmupDiscoveryInterval());
        assertEquals(Duration.ofSeconds(30), policy.steadyDiscoveryInterval());
        assertEquals(Duration.ofMillis(500), policy.injectorInterval());
        assertEquals(Duration.ofSeconds(1), policy.broadcastTimeout());
    }

    @Test
    void discoveryIntervalIsShortDuringWarmup() {
        GroupChatTimingPolicy policy = GroupChatTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(5), policy.discoveryIntervalAfter(Duration.ZERO));
        assertEquals(Duration.ofSeconds(5), policy.discoveryIntervalAfter(Duration.ofSeconds(29)));
    }

    @Test
    void discoveryIntervalIsLongAfterWarmup() {
        GroupChatTimingPolicy policy = GroupChatTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(30), policy.discoveryIntervalAfter(Duration.ofSeconds(30)));
        assertEquals(Duration.ofSeconds(30), policy.discoveryIntervalAfter(Duration.ofMinutes(10)));
    }

    @Test
    void scanBudgetCoversEveryConnectTimeoutPlusSlack() {
        GroupChatTimingPolicy policy = GroupChatTimingPolicy.defaults();

        assertEquals(Duration.ofMillis(6000), policy.scanBudget(10));
    }

    @Test
    void rejectsZeroConnectTimeout() {
        GroupChatTimingPolicy d = GroupChatTimingPolicy.defaults();
        assertThrows(IllegalArgumentException.class, () -> new GroupChatTimingPolicy(
                Duration.ZERO, d.secondPassDelay(), d.warmupWindow(), d.warmupDiscoveryInterval(),
                d.steadyDiscoveryInterval(), d.injectorInterval(), d.broadcastTimeout()));
    }

    @Test
    void acceptsZeroSecondPassDelay() {
        GroupChatTimingPolicy d = GroupChatTimingPolicy.defaults();
        GroupChatTimingPolicy policy = new GroupChatTimingPolicy(
                d.connectTimeout(), Duration.ZERO, d.warmupWindow(), d.warmupDiscoveryInterval(),
                d.steadyDiscoveryInterval(), d.injectorInterval(), d.broadcastTimeout());

        assertEquals(Duration.ZERO, policy.secondPassDelay());
    }

    @Test
    void rejectsNullDurations() {
        GroupChatTimingPolicy d = GroupChatTimingPolicy.defaults();
        assertThrows(NullPointerException.class, () -> new GroupChatTimingPolicy(
                d.connectTimeout(), d.secondPassDelay(), d.warmupWindow(), d.warmupDiscoveryInterval(),
                d.steadyDiscoveryInterval(), d.injectorInterval(), null));
    }
}
