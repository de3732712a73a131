package com.questrail.streaming.digitizer.model;

import com.questrail.streaming.digitizer.error.MissingRequiredFieldException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FrameMetadataTest
{
    private static final GpsTime TIME = new GpsTime(24, 100, 1, 2, 3, 4, 5, 6);

    @Test
    void builderProducesEqualValues()
    {
        FrameMetadata a = FrameMetadata.builder().withTimestamp(TIME).withFrameNumber(9).build();
        FrameMetadata b = new FrameMetadata(TIME, 0, 0, true, 9, 0);

        assertEquals(b, a);
        assertTrue(a.running());
    }

    @Test
    void missingTimestampIsRejected()
    {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> FrameMetadata.builder().build());
        assertEquals("metadata.timestamp", e.field());
    }

    @Test
    void vetoBitsAreReadIndividually()
    {
        FrameMetadata metadata = FrameMetadata.builder()
                .withTimestamp(TIME)
                .withVetoFlags(0b1000_0000_0000_0100)
                .build();

        assertTrue(metadata.isVetoed());
        assertTrue(metadata.hasVetoBit(2));
        assertTrue(metadata.hasVetoBit(15));
        assertFalse(metadata.hasVetoBit(0));
        assertThrows(IllegalArgumentException.class, () -> metadata.hasVetoBit(16));
    }

    @Test
    void rejectsValuesWiderThanTheirFields()
    {
        assertThrows(IllegalArgumentException.class, () -> new FrameMetadata(TIME, 0, 256, true, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new FrameMetadata(TIME, 0, 0, true, 0x1_0000_0000L, 0));
        assertThrows(IllegalArgumentException.class, () -> new FrameMetadata(TIME, 0, 0, true, 0, 0x1_0000));
    }

    @Test
    void periodNumberIsPrintedUnsigned()
    {
        FrameMetadata metadata = new FrameMetadata(TIME, -1L, 0, false, 0, 0);
        assertTrue(metadata.toString().contains("periodNumber=18446744073709551615"));
    }
}
