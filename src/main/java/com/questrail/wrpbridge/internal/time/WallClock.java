package com.questrail.wrpbridge.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for event timestamps. Never used to schedule anything.
 */
public interface WallClock
{
    Instant now();
}
