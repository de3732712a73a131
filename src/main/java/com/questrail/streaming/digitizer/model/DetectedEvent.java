package com.questrail.streaming.digitizer.model;

/**
 * One row of an event list: the values found at the same index of the time,
 * voltage and channel sequences.
 */
public record DetectedEvent(long time, int voltage, long channel)
{
}
