package com.questrail.streaming.digitizer.model;

/**
 * Closed union of the two digitizer message kinds.
 *
 * <p>Both variants embed a {@link FrameMetadata} by value. There is no shared
 * base state; this interface only exposes the fields the variants have in
 * common so consumers can route and log without knowing the concrete kind.</p>
 */
public sealed interface DigitizerMessage
        permits EventListMessage, AnalogTraceMessage
{
    /**
     * Returns the 8-bit identifier of the source digitizer.
     */
    int digitizerId();

    /**
     * Returns the frame metadata; never null.
     */
    FrameMetadata metadata();

    /**
     * Returns the kind whose format identifier this message is encoded under.
     */
    MessageKind kind();

    /**
     * Returns an equal message that no longer borrows from any decoded buffer.
     */
    DigitizerMessage owned();
}
