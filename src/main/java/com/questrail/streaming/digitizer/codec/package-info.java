/**
 * Digitizer Message Codec Boundary
 * =============================================================================
 *
 * <p>This package defines the public codec contract for the two digitizer
 * message kinds and the identifier peek used to route between them.</p>
 *
 * <pre>
 *   producer message
 *        → DigitizerMessageCodec.encode   (validation + exact layout)
 *            → ByteBuf                   ("dev2" / "dat2" at bytes 4-7)
 *                → external transport
 *                    → MessageIdentifier.identify
 *                        → DigitizerMessageCodec.decode
 * </pre>
 *
 * <p>Transport, partitioning and schema discovery are not part of this
 * package. Buffers arrive whole; there is no incremental decoding.</p>
 */
package com.questrail.streaming.digitizer.codec;
