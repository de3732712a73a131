package com.questrail.streaming.digitizer.observability;

import java.time.Instant;

/**
 * Record of a buffer whose format identifier matched no known schema.
 *
 * @param identifier the printable identifier text, or null if the buffer was
 *                   too short to carry a root offset and identifier
 * @param length     readable length of the buffer
 */
public record UnknownMessageEvent(
    Instant timestamp,
    String identifier,
    int length
) {
}
