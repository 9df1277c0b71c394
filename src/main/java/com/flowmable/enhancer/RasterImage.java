package com.flowmable.enhancer;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Decoded 8-bit raster with channel-interleaved samples.
 * <p>
 * Layout: {@code data[(y * width + x) * channels + c]}, unsigned bytes.
 * A raster owns its buffer; callers hand the array over and must not keep
 * writing to it. Transform stages never mutate their input, they build a
 * new raster via {@link #blankLike()} or {@link #copy()}.
 */
public final class RasterImage {

    public static final int RGB = 3;
    public static final int RGBA = 4;

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    public RasterImage(int width, int height, int channels, byte[] data) {
        if (data.length != bufferLength(width, height, channels)) {
            throw new IllegalArgumentException("Buffer length " + data.length
                    + " does not match " + width + "x" + height + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    /** Blank (all zero) raster of the given shape. */
    public static RasterImage create(int width, int height, int channels) {
        return new RasterImage(width, height, channels, new byte[bufferLength(width, height, channels)]);
    }

    /**
     * Sample count of a raster shape.
     *
     * @throws IllegalArgumentException if the shape is negative or does not fit in one array
     */
    static int bufferLength(int width, int height, int channels) {
        if (width < 0 || height < 0 || channels < 1) {
            throw new IllegalArgumentException(
                    "Bad raster shape: " + width + "x" + height + "x" + channels);
        }
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), channels);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Raster too large: " + width + "x" + height + "x" + channels, e);
        }
    }

    /**
     * Convert an AWT image into an RGB raster, or RGBA when the source has alpha.
     */
    public static RasterImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        boolean alpha = image.getColorModel().hasAlpha();
        int ch = alpha ? RGBA : RGB;
        byte[] buf = new byte[bufferLength(w, h, ch)];
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            int o = y * w * ch;
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                buf[o] = (byte) (argb >> 16);
                buf[o + 1] = (byte) (argb >> 8);
                buf[o + 2] = (byte) argb;
                if (alpha) {
                    buf[o + 3] = (byte) (argb >>> 24);
                }
                o += ch;
            }
        }
        return new RasterImage(w, h, ch, buf);
    }

    /**
     * Convert back to an AWT image (TYPE_INT_RGB or TYPE_INT_ARGB).
     *
     * @throws UnsupportedFormatException if the raster is neither RGB nor RGBA
     */
    public BufferedImage toBufferedImage() {
        if (channels != RGB && channels != RGBA) {
            throw new UnsupportedFormatException("encode", channels);
        }
        boolean alpha = channels == RGBA;
        BufferedImage out = new BufferedImage(width, height,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            int o = y * width * channels;
            for (int x = 0; x < width; x++) {
                int a = alpha ? data[o + 3] & 0xFF : 0xFF;
                row[x] = (a << 24)
                        | ((data[o] & 0xFF) << 16)
                        | ((data[o + 1] & 0xFF) << 8)
                        | (data[o + 2] & 0xFF);
                o += channels;
            }
            out.setRGB(0, y, width, 1, row, 0, width);
        }
        return out;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    public boolean hasAlpha() {
        return channels == RGBA;
    }

    // Cannot overflow: width * height * channels was checked on construction
    public int pixelCount() {
        return width * height;
    }

    /** Backing buffer, exposed for the pixel kernels. */
    byte[] data() {
        return data;
    }

    /** Sample at (x, y, c) as 0..255. */
    public int get(int x, int y, int c) {
        return data[(y * width + x) * channels + c] & 0xFF;
    }

    /** Write a sample, clamped to 0..255. */
    public void set(int x, int y, int c, int value) {
        data[(y * width + x) * channels + c] = (byte) PixelKernels.clamp(value);
    }

    /** Set all colour channels of a pixel; alpha (if any) becomes opaque. */
    public void setPixel(int x, int y, int r, int g, int b) {
        int o = (y * width + x) * channels;
        data[o] = (byte) PixelKernels.clamp(r);
        data[o + 1] = (byte) PixelKernels.clamp(g);
        data[o + 2] = (byte) PixelKernels.clamp(b);
        if (channels == RGBA) {
            data[o + 3] = (byte) 0xFF;
        }
    }

    public RasterImage copy() {
        return new RasterImage(width, height, channels, data.clone());
    }

    /**
     * Zeroed raster of the same shape, alpha copied over so stages only
     * need to write colour channels.
     */
    RasterImage blankLike() {
        byte[] buf = new byte[data.length];
        if (channels == RGBA) {
            for (int i = 3; i < buf.length; i += RGBA) {
                buf[i] = data[i];
            }
        }
        return new RasterImage(width, height, channels, buf);
    }

    /** True when both rasters have the same shape and identical samples. */
    public boolean contentEquals(RasterImage other) {
        return other != null
                && width == other.width
                && height == other.height
                && channels == other.channels
                && Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + ", channels=" + channels + "]";
    }
}
