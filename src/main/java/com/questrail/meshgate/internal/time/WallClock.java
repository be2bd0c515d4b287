package com.questrail.meshgate.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for operator-facing timestamps (last heard, request
 * creation time, server time). Never used for deadlines.
 */
public interface WallClock
{
    Instant now();
}
