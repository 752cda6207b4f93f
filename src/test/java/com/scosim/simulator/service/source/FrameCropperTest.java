package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;
import com.scosim.simulator.model.FramePair;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameCropperTest {

    /** Each pixel encodes its own coordinates: B = x / 4, G = y / 4, R = 1. */
    private static BgrImage coordinates(int width, int height) {
        byte[] data = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = (y * width + x) * 3;
                data[i] = (byte) (x / 4);
                data[i + 1] = (byte) (y / 4);
                data[i + 2] = 1;
            }
        }
        return new BgrImage(width, height, data);
    }

    @Test
    void testSplit_DefaultGeometry() {
        FrameCropper cropper = new FrameCropper(800, 640, 640, 480, 160);
        BgrImage capture = coordinates(800, 640);

        FramePair pair = cropper.split(capture, 1234L);

        assertEquals(640, pair.getPrimary().getWidth());
        assertEquals(480, pair.getPrimary().getHeight());
        assertEquals(160, pair.getCode().getWidth());
        assertEquals(160, pair.getCode().getHeight());
        // primary starts at (0, 0), code at (640, 480)
        assertEquals(0, pair.getPrimary().copyData()[0]);
        assertEquals(0, pair.getPrimary().copyData()[1]);
        assertEquals((byte) (640 / 4), pair.getCode().copyData()[0]);
        assertEquals((byte) (480 / 4), pair.getCode().copyData()[1]);
    }

    @Test
    void testSplit_SharesTimestampAndIsDeterministic() {
        FrameCropper cropper = new FrameCropper(800, 640, 640, 480, 160);
        BgrImage capture = coordinates(800, 640);

        FramePair first = cropper.split(capture, 42L);
        FramePair second = cropper.split(capture, 42L);

        assertEquals(42L, first.getTimestamp());
        assertEquals(42L, first.primaryFrame().getTimestamp());
        assertTrue(first.getPrimary().samePixels(second.getPrimary()));
        assertTrue(first.getCode().samePixels(second.getCode()));
    }

    @Test
    void testOverlappingGeometryRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FrameCropper(800, 640, 700, 500, 160));
        assertThrows(IllegalArgumentException.class, () -> new FrameCropper(800, 640, 900, 480, 160));
        assertThrows(IllegalArgumentException.class, () -> new FrameCropper(800, 640, 640, 480, 700));
    }

    @Test
    void testWrongCaptureSizeRejected() {
        FrameCropper cropper = new FrameCropper(800, 640, 640, 480, 160);

        assertThrows(IllegalArgumentException.class, () -> cropper.split(BgrImage.blank(640, 480), 0L));
    }
}
