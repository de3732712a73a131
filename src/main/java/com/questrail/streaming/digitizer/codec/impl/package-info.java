/**
 * Digitizer Codec Implementation (Wire Level)
 * =============================================================================
 *
 * <p>Concrete codecs for the {@code "dev2"} event-list and {@code "dat2"}
 * analog-trace FlatBuffers, plus the shared GpsTime struct and frame-metadata
 * table. Messages are built with the FlatBuffers runtime's
 * {@code FlatBufferBuilder} and read through {@code Table} subclasses.</p>
 *
 * <pre>
 *   ByteBuf
 *        → WireBuffer.checkIdentifier (bytes 4-7)
 *        → EventListTable / AnalogTraceTable (root table via vtable)
 *        → FrameMetadataTable / GpsTimeStruct
 *        → vectors (borrowed slice or owned copy)
 *        → EventListMessage / AnalogTraceMessage
 * </pre>
 *
 * <p>Every offset is bounds-checked before the runtime follows it. Any
 * structural failure is reported as a typed {@code DigitizerCodecException};
 * nothing here repairs or pads a buffer.</p>
 */
package com.questrail.streaming.digitizer.codec.impl;
