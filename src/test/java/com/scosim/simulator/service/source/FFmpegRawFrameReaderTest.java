package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FFmpegRawFrameReaderTest {

    private static final int WIDTH = 8;
    private static final int HEIGHT = 6;
    private static final int FPS = 100;
    private static final long INTERVAL_MICROS = 1_000_000L / FPS;

    /**
     * In-memory clip: frame i is filled with byte i + 1 and stamped i * interval. Seeking to 0 rewinds it.
     */
    private static class ScriptedGrabber extends FFmpegFrameGrabber {
        private final List<Frame> frames = new ArrayList<>();
        private int position;
        int rewinds;
        boolean released;
        FFmpegFrameGrabber.Exception failure;

        ScriptedGrabber(int frameCount, int width, int height) {
            super("scripted.mp4");
            for (int i = 0; i < frameCount; i++) {
                Frame frame = new Frame(width, height, Frame.DEPTH_UBYTE, 3);
                ByteBuffer buf = (ByteBuffer) frame.image[0];
                for (int b = 0; b < buf.capacity(); b++) {
                    buf.put(b, (byte) (i + 1));
                }
                frame.timestamp = i * INTERVAL_MICROS;
                frames.add(frame);
            }
        }

        @Override
        public Frame grabImage() throws FFmpegFrameGrabber.Exception {
            if (failure != null) {
                throw failure;
            }
            return position < frames.size() ? frames.get(position++) : null;
        }

        @Override
        public void setTimestamp(long timestamp) {
            position = 0;
            rewinds++;
        }

        @Override
        public void stop() {
        }

        @Override
        public void release() {
            released = true;
        }
    }

    private static FFmpegRawFrameReader reader(ScriptedGrabber grabber) {
        return new FFmpegRawFrameReader(grabber, new MediaResourceCleaner(), WIDTH, HEIGHT, FPS);
    }

    private static int marker(BgrImage image) {
        return image.copyData()[0];
    }

    @Test
    void testRead_LoopsClipFromFirstFrame() throws Exception {
        ScriptedGrabber grabber = new ScriptedGrabber(5, WIDTH, HEIGHT);
        FFmpegRawFrameReader reader = reader(grabber);

        List<Integer> markers = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            markers.add(marker(reader.read()));
        }

        assertEquals(List.of(1, 2, 3, 4, 5, 1, 2, 3, 4, 5, 1, 2, 3, 4, 5, 1, 2, 3, 4, 5), markers);
        assertEquals(3, grabber.rewinds);
    }

    @Test
    void testRead_SingleFrameClipRepeats() throws Exception {
        ScriptedGrabber grabber = new ScriptedGrabber(1, WIDTH, HEIGHT);
        FFmpegRawFrameReader reader = reader(grabber);

        for (int i = 0; i < 4; i++) {
            assertEquals(1, marker(reader.read()));
        }
    }

    @Test
    void testRead_EmptyClipIsEndOfStream() throws Exception {
        FFmpegRawFrameReader reader = reader(new ScriptedGrabber(0, WIDTH, HEIGHT));

        assertNull(reader.read());
    }

    @Test
    void testRead_ConvertsFramePixels() throws Exception {
        BgrImage image = reader(new ScriptedGrabber(2, WIDTH, HEIGHT)).read();

        assertEquals(WIDTH, image.getWidth());
        assertEquals(HEIGHT, image.getHeight());
        for (byte b : image.copyData()) {
            assertEquals(1, b);
        }
    }

    @Test
    void testRead_WrongFrameSizeIsReadError() {
        FFmpegRawFrameReader reader = new FFmpegRawFrameReader(new ScriptedGrabber(2, WIDTH * 2, HEIGHT),
                new MediaResourceCleaner(), WIDTH, HEIGHT, FPS);

        assertThrows(FrameReadException.class, reader::read);
    }

    @Test
    void testRead_DecoderFailureIsReadError() {
        ScriptedGrabber grabber = new ScriptedGrabber(2, WIDTH, HEIGHT);
        grabber.failure = new FFmpegFrameGrabber.Exception("corrupt packet");

        FrameReadException e = assertThrows(FrameReadException.class, () -> reader(grabber).read());
        assertTrue(e.getMessage().contains("corrupt packet"));
    }

    @Test
    void testClose_ReleasesGrabber() {
        ScriptedGrabber grabber = new ScriptedGrabber(1, WIDTH, HEIGHT);

        reader(grabber).close();

        assertTrue(grabber.released);
    }
}
