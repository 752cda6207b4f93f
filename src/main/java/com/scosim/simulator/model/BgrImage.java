package com.scosim.simulator.model;

import lombok.Getter;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;
import java.util.Objects;

/**
 * Packed 8-bit BGR pixel buffer, row-major with no row padding.
 * Treated as immutable once constructed; every operation that changes pixels returns a new image.
 */
public class BgrImage {

    @Getter
    private final int width;
    @Getter
    private final int height;
    private final byte[] data;

    public BgrImage(int width, int height, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid image size " + width + "x" + height);
        }
        Objects.requireNonNull(data, "data");
        if (data.length != width * height * 3) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height * 3) + " bytes for " + width + "x" + height + ", got " + data.length);
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public static BgrImage blank(int width, int height) {
        return new BgrImage(width, height, new byte[width * height * 3]);
    }

    /**
     * Copy a Java2D image into a new BGR buffer. Any image type is accepted.
     */
    public static BgrImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        if (image.getType() == BufferedImage.TYPE_3BYTE_BGR) {
            byte[] src = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            if (src.length == w * h * 3) {
                return new BgrImage(w, h, src.clone());
            }
        }
        byte[] out = new byte[w * h * 3];
        int i = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = image.getRGB(x, y);
                out[i++] = (byte) (rgb & 0xFF);
                out[i++] = (byte) ((rgb >> 8) & 0xFF);
                out[i++] = (byte) ((rgb >> 16) & 0xFF);
            }
        }
        return new BgrImage(w, h, out);
    }

    /**
     * Copy a rectangular region into a new image.
     */
    public BgrImage crop(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height) {
            throw new IllegalArgumentException(String.format(
                    "Region %d,%d %dx%d outside image %dx%d", x, y, w, h, width, height));
        }
        byte[] out = new byte[w * h * 3];
        int rowBytes = w * 3;
        for (int row = 0; row < h; row++) {
            System.arraycopy(data, ((y + row) * width + x) * 3, out, row * rowBytes, rowBytes);
        }
        return new BgrImage(w, h, out);
    }

    /**
     * @return a copy of the packed pixels; the image itself cannot be changed through it
     */
    public byte[] copyData() {
        return data.clone();
    }

    public BgrImage copy() {
        return new BgrImage(width, height, data.clone());
    }

    /**
     * @return a TYPE_3BYTE_BGR image holding a copy of the pixels
     */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(data, 0, target, 0, data.length);
        return image;
    }

    public boolean samePixels(BgrImage other) {
        return other != null && width == other.width && height == other.height && Arrays.equals(data, other.data);
    }
}
