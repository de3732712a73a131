package com.questrail.streaming.digitizer.observability;

import com.questrail.streaming.digitizer.model.MessageKind;

import java.time.Instant;

/**
 * Record of a buffer that was identified and decoded successfully.
 */
public record MessageReceivedEvent(
    Instant timestamp,
    MessageKind kind,
    int digitizerId,
    long frameNumber
) {
}
