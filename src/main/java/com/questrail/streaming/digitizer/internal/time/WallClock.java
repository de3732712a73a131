package com.questrail.streaming.digitizer.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for frame timestamps and observability events.
 *
 * <p>Injected so that producers and sinks can be driven by a fixed clock in
 * tests. The codecs themselves never read the clock.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
