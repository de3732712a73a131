package com.questrail.streaming.digitizer.dispatch;

/**
 * What {@link DigitizerMessageDispatcher#dispatch} did with one buffer.
 */
public enum DispatchOutcome
{
    /** Decoded and delivered to the handler. */
    DELIVERED,

    /** Identifier matched no schema; passed to {@link DigitizerMessageHandler#onUnknown}. */
    UNKNOWN,

    /** Identifier was recognised but the buffer failed to decode. */
    FAILED
}
