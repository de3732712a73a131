package com.questrail.streaming.digitizer.dispatch;

import com.questrail.streaming.digitizer.codec.MessageIdentifier;
import com.questrail.streaming.digitizer.codec.Ownership;
import com.questrail.streaming.digitizer.codec.impl.AnalogTraceMessageCodec;
import com.questrail.streaming.digitizer.codec.impl.EventListMessageCodec;
import com.questrail.streaming.digitizer.config.DigitizerCodecConfig;
import com.questrail.streaming.digitizer.error.BadIdentifierException;
import com.questrail.streaming.digitizer.error.DigitizerCodecException;
import com.questrail.streaming.digitizer.internal.time.SystemWallClock;
import com.questrail.streaming.digitizer.internal.time.WallClock;
import com.questrail.streaming.digitizer.model.AnalogTraceMessage;
import com.questrail.streaming.digitizer.model.DigitizerMessage;
import com.questrail.streaming.digitizer.model.EventListMessage;
import com.questrail.streaming.digitizer.model.MessageKind;
import com.questrail.streaming.digitizer.observability.CodecObservabilitySink;
import com.questrail.streaming.digitizer.observability.DecodeFailureEvent;
import com.questrail.streaming.digitizer.observability.MessageReceivedEvent;
import com.questrail.streaming.digitizer.observability.NullObservabilitySink;
import com.questrail.streaming.digitizer.observability.UnknownMessageEvent;
import io.netty.buffer.ByteBuf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * DigitizerMessageDispatcher
 * =============================================================================
 * Consumer-side router from opaque transport buffers to typed messages.
 *
 * <h2>Architectural Role</h2>
 * <pre>
 *   ByteBuf (from transport)
 *        → MessageIdentifier.identify     (4-byte peek, no parse)
 *            → EventListMessageCodec / AnalogTraceMessageCodec
 *                → DigitizerMessageHandler
 * </pre>
 *
 * <p>Unknown identifiers are reported, never coerced into a known shape.
 * Decode failures are reported to the observability sink and surfaced as
 * {@link DispatchOutcome#FAILED}; they are not rethrown, so one malformed
 * buffer cannot stop a consumer loop. Exceptions thrown by the handler itself
 * propagate to the caller.</p>
 *
 * <p>The dispatcher holds no mutable state and is safe to share between
 * consumer threads, provided the sink and handler are.</p>
 */
public final class DigitizerMessageDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(DigitizerMessageDispatcher.class);

    private final EventListMessageCodec eventListCodec;
    private final AnalogTraceMessageCodec analogTraceCodec;
    private final Ownership ownership;
    private final CodecObservabilitySink sink;
    private final WallClock clock;

    public DigitizerMessageDispatcher()
    {
        this(DigitizerCodecConfig.defaults(), NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public DigitizerMessageDispatcher(DigitizerCodecConfig config,
                                      CodecObservabilitySink sink,
                                      WallClock clock)
    {
        Objects.requireNonNull(config, "config");
        this.eventListCodec = new EventListMessageCodec(config);
        this.analogTraceCodec = new AnalogTraceMessageCodec(config);
        this.ownership = config.defaultOwnership();
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decodes a buffer of either known kind.
     *
     * @throws BadIdentifierException  if the identifier matches no known schema
     * @throws DigitizerCodecException if the buffer is malformed
     */
    public DigitizerMessage decode(ByteBuf buffer, Ownership ownership)
    {
        Objects.requireNonNull(buffer, "buffer");

        final MessageKind kind = MessageIdentifier.identify(buffer);
        return switch (kind) {
            case EVENT_LIST -> eventListCodec.decode(buffer, ownership);
            case ANALOG_TRACE -> analogTraceCodec.decode(buffer, ownership);
            case UNKNOWN -> throw new BadIdentifierException(
                    MessageKind.EVENT_LIST.identifier() + "|" + MessageKind.ANALOG_TRACE.identifier(),
                    MessageIdentifier.peekIdentifier(buffer).orElse(""));
        };
    }

    public DigitizerMessage decode(ByteBuf buffer)
    {
        return decode(buffer, ownership);
    }

    /**
     * Identifies, decodes and delivers one buffer.
     *
     * <p>The buffer is not released; it remains owned by the caller. With
     * borrowed ownership the delivered message is only valid until then.</p>
     */
    public DispatchOutcome dispatch(ByteBuf buffer, DigitizerMessageHandler handler)
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(handler, "handler");

        final MessageKind kind = MessageIdentifier.identify(buffer);
        if (kind == MessageKind.UNKNOWN) {
            sink.onUnknownMessage(new UnknownMessageEvent(
                    clock.now(),
                    MessageIdentifier.peekIdentifier(buffer).orElse(null),
                    buffer.readableBytes()));
            handler.onUnknown(buffer);
            return DispatchOutcome.UNKNOWN;
        }

        final DigitizerMessage message;
        try {
            message = decode(buffer, ownership);
        }
        catch (DigitizerCodecException e) {
            sink.onDecodeFailure(new DecodeFailureEvent(clock.now(), kind, e));
            return DispatchOutcome.FAILED;
        }

        log.debug("Dispatching {} from digitizer {}, metadata: {}",
                kind, message.digitizerId(), message.metadata());

        if (message instanceof EventListMessage eventList) {
            handler.onEventList(eventList);
        }
        else if (message instanceof AnalogTraceMessage analogTrace) {
            handler.onAnalogTrace(analogTrace);
        }

        sink.onMessageReceived(new MessageReceivedEvent(
                clock.now(),
                kind,
                message.digitizerId(),
                message.metadata().frameNumber()));
        return DispatchOutcome.DELIVERED;
    }
}
