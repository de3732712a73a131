package com.questrail.streaming.digitizer.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 *
 * <p>Buffers that are merely not ours are logged quietly; buffers that claim a
 * known identifier and turn out malformed are data-integrity incidents and are
 * logged as warnings.</p>
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        log.debug("Received {}: digitizer {}, frame {}",
            event.kind(), event.digitizerId(), event.frameNumber());
    }

    @Override
    public void onUnknownMessage(UnknownMessageEvent event) {
        log.warn("Unexpected message type: identifier {}, {} byte(s)",
            event.identifier() != null ? "\"" + event.identifier() + "\"" : "<none>",
            event.length());
    }

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {
        if (event.cause().isDataIntegrityFailure()) {
            log.warn("Failed to decode {} message ({}): {}",
                event.kind(), event.errorKind(), event.message());
        } else {
            log.debug("Skipped {} message ({}): {}",
                event.kind(), event.errorKind(), event.message());
        }
    }
}
