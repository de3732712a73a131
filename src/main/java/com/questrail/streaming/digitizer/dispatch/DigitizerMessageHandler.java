package com.questrail.streaming.digitizer.dispatch;

import com.questrail.streaming.digitizer.model.AnalogTraceMessage;
import com.questrail.streaming.digitizer.model.EventListMessage;
import io.netty.buffer.ByteBuf;

/**
 * Consumer callback receiving decoded digitizer messages from
 * {@link DigitizerMessageDispatcher}.
 *
 * <p>Messages passed here may borrow from the dispatched buffer (see
 * {@link com.questrail.streaming.digitizer.codec.Ownership}). A handler that
 * keeps a message beyond the callback should call {@code owned()} on it.</p>
 */
public interface DigitizerMessageHandler
{
    void onEventList(EventListMessage message);

    void onAnalogTrace(AnalogTraceMessage message);

    /**
     * Called for a buffer whose identifier matches no known schema. The
     * buffer is not decoded. Default: ignore.
     */
    default void onUnknown(ByteBuf buffer) {}
}
