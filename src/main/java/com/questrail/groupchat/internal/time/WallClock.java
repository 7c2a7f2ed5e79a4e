package com.questrail.groupchat.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for message timestamps and observability events.
 *
 * <p>May jump under NTP adjustment. Never used to decide when a task runs.</p>
 */
public interface WallClock
{
    Instant now();
}
