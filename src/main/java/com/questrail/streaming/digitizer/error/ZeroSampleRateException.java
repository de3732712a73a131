package com.questrail.streaming.digitizer.error;

/**
 * An analog trace declared a sample rate of zero, leaving its timebase undefined.
 */
public final class ZeroSampleRateException extends DigitizerCodecException
{
    public ZeroSampleRateException() {
        super("Analog trace sample rate must be non-zero");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ZERO_SAMPLE_RATE;
    }
}
