package com.questrail.streaming.digitizer.codec;

/**
 * Per-call choice of how decoded sequences relate to the input buffer.
 */
public enum Ownership
{
    /**
     * Decoded sequences are read-only slices of the input buffer. No sample
     * data is copied. The result is valid only until the caller releases or
     * overwrites the buffer; the decoder does not retain it.
     */
    BORROWED,

    /**
     * Decoded sequences are copied onto the heap. The result is independent of
     * the input buffer and may outlive it.
     */
    OWNED
}
