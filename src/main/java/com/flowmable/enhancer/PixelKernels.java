package com.flowmable.enhancer;

import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Shared pixel arithmetic and row scheduling for the statistics engine and
 * the transform stages.
 * <p>
 * Every kernel works on the raw interleaved buffer of a {@link RasterImage}
 * and writes each output row from exactly one task, so a parallel run is
 * bit-identical to a sequential one.
 */
public final class PixelKernels {

    private PixelKernels() {}

    /** Rasters at or above this pixel count are processed row-parallel. */
    static final int PARALLEL_PIXEL_THRESHOLD = 1 << 16;

    // Rec. 601 luma weights
    static final double LUMA_R = 0.299;
    static final double LUMA_G = 0.587;
    static final double LUMA_B = 0.114;

    public static int clamp(int v) {
        return v < 0 ? 0 : (v > 255 ? 255 : v);
    }

    /** Round half up, then clamp to 0..255. */
    public static int clampRound(double v) {
        if (v <= 0) return 0;
        if (v >= 255) return 255;
        return (int) Math.floor(v + 0.5);
    }

    /** Truncate toward zero, then clamp to 0..255. */
    public static int clampTruncate(double v) {
        if (v <= 0) return 0;
        if (v >= 255) return 255;
        return (int) v;
    }

    public static double luma(int r, int g, int b) {
        return LUMA_R * r + LUMA_G * g + LUMA_B * b;
    }

    /**
     * Integer luma plane of a raster, one value per pixel, row-major.
     */
    static int[] lumaPlane(RasterImage raster) {
        byte[] src = raster.data();
        int ch = raster.channels();
        int n = raster.pixelCount();
        int[] plane = new int[n];
        for (int i = 0, o = 0; i < n; i++, o += ch) {
            plane[i] = (int) Math.round(luma(src[o] & 0xFF, src[o + 1] & 0xFF, src[o + 2] & 0xFF));
        }
        return plane;
    }

    /**
     * Run {@code rowTask} for every row index. Large rasters are spread
     * over the common fork-join pool.
     */
    static void forEachRow(RasterImage raster, IntConsumer rowTask) {
        IntStream rows = IntStream.range(0, raster.height());
        if (raster.pixelCount() >= PARALLEL_PIXEL_THRESHOLD) {
            rows = rows.parallel();
        }
        rows.forEach(rowTask);
    }

    /** Per-pixel colour operation writing its result at {@code dst[o..o+2]}. */
    @FunctionalInterface
    interface PixelOp {
        void apply(int r, int g, int b, byte[] dst, int o);
    }

    /**
     * Apply a colour operation to every pixel into a new raster.
     * Alpha is carried over by {@link RasterImage#blankLike()}.
     */
    static RasterImage mapPixels(RasterImage input, PixelOp op) {
        RasterImage out = input.blankLike();
        byte[] src = input.data();
        byte[] dst = out.data();
        int w = input.width();
        int ch = input.channels();
        forEachRow(input, y -> {
            for (int o = y * w * ch, end = o + w * ch; o < end; o += ch) {
                op.apply(src[o] & 0xFF, src[o + 1] & 0xFF, src[o + 2] & 0xFF, dst, o);
            }
        });
        return out;
    }

    /**
     * Normalized 1-D Gaussian kernel with the given standard deviation.
     * Half-width is {@code ceil(3 * sigma)}.
     */
    static double[] gaussianKernel(double sigma) {
        int half = Math.max(1, (int) Math.ceil(sigma * 3.0));
        double[] kernel = new double[2 * half + 1];
        double twoSigmaSq = 2.0 * sigma * sigma;
        double sum = 0;
        for (int i = -half; i <= half; i++) {
            double w = Math.exp(-(i * i) / twoSigmaSq);
            kernel[i + half] = w;
            sum += w;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    /**
     * Separable Gaussian blur of the colour channels, edge pixels replicated.
     * Alpha is copied unchanged. Blurred samples are rounded to integers.
     */
    static RasterImage gaussianBlur(RasterImage raster, double sigma) {
        double[] kernel = gaussianKernel(sigma);
        int half = kernel.length / 2;
        int w = raster.width();
        int h = raster.height();
        int ch = raster.channels();
        byte[] src = raster.data();

        // Horizontal pass into a float buffer (RGB only)
        double[] tmp = new double[w * h * 3];
        forEachRow(raster, y -> {
            int rowBase = y * w;
            for (int x = 0; x < w; x++) {
                double r = 0, g = 0, b = 0;
                for (int k = -half; k <= half; k++) {
                    int sx = Math.min(w - 1, Math.max(0, x + k));
                    int o = (rowBase + sx) * ch;
                    double kw = kernel[k + half];
                    r += kw * (src[o] & 0xFF);
                    g += kw * (src[o + 1] & 0xFF);
                    b += kw * (src[o + 2] & 0xFF);
                }
                int t = (rowBase + x) * 3;
                tmp[t] = r;
                tmp[t + 1] = g;
                tmp[t + 2] = b;
            }
        });

        RasterImage out = raster.blankLike();
        byte[] dst = out.data();
        forEachRow(raster, y -> {
            for (int x = 0; x < w; x++) {
                double r = 0, g = 0, b = 0;
                for (int k = -half; k <= half; k++) {
                    int sy = Math.min(h - 1, Math.max(0, y + k));
                    int t = (sy * w + x) * 3;
                    double kw = kernel[k + half];
                    r += kw * tmp[t];
                    g += kw * tmp[t + 1];
                    b += kw * tmp[t + 2];
                }
                int o = (y * w + x) * ch;
                dst[o] = (byte) clampRound(r);
                dst[o + 1] = (byte) clampRound(g);
                dst[o + 2] = (byte) clampRound(b);
            }
        });
        return out;
    }
}
