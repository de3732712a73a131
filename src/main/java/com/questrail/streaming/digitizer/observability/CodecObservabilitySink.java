package com.questrail.streaming.digitizer.observability;

/**
 * Receives observability events from the consumer-side dispatcher.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CodecObservabilitySink {
    /**
     * Called after a buffer has been decoded and handed to its handler.
     * @param event the received message summary
     */
    void onMessageReceived(MessageReceivedEvent event);

    /**
     * Called when a buffer carries an identifier that no codec recognises.
     * @param event the unknown buffer summary
     */
    void onUnknownMessage(UnknownMessageEvent event);

    /**
     * Called when a buffer with a known identifier fails to decode.
     * @param event the failure details
     */
    void onDecodeFailure(DecodeFailureEvent event);
}
