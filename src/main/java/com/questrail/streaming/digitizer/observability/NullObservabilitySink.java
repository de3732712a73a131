package com.questrail.streaming.digitizer.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {}

    @Override
    public void onUnknownMessage(UnknownMessageEvent event) {}

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {}
}
