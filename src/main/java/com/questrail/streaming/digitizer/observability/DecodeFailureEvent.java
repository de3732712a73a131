package com.questrail.streaming.digitizer.observability;

import com.questrail.streaming.digitizer.error.DigitizerCodecException;
import com.questrail.streaming.digitizer.error.ErrorKind;
import com.questrail.streaming.digitizer.model.MessageKind;

import java.time.Instant;

/**
 * Record of a buffer that carried a known identifier but could not be decoded.
 */
public record DecodeFailureEvent(
    Instant timestamp,
    MessageKind kind,
    DigitizerCodecException cause
) {
    public ErrorKind errorKind() {
        return cause.kind();
    }

    public String message() {
        return cause.getMessage();
    }
}
