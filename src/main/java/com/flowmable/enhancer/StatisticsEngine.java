package com.flowmable.enhancer;

/**
 * Photometric statistics extraction.
 * <p>
 * Computes per-channel means and standard deviations plus the derived
 * brightness, contrast and green-dominance figures, and on request the
 * detail metrics: Laplacian sharpness, HSV saturation, luma dynamic range
 * and a residual noise estimate.
 * <p>
 * Alpha is ignored for all statistics. Stateless apart from the injected
 * thresholds; safe to share between threads.
 */
public class StatisticsEngine {

    static final String STEP = "analysis";

    private final EnhancementThresholds thresholds;

    public StatisticsEngine() {
        this(EnhancementThresholds.DEFAULT);
    }

    public StatisticsEngine(EnhancementThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Basic channel statistics and flags.
     *
     * @throws UnsupportedFormatException if the raster is neither RGB nor RGBA
     * @throws InvalidDimensionsException if width or height is zero
     */
    public PhotoStatistics analyze(RasterImage raster) {
        validate(raster, STEP);
        byte[] data = raster.data();
        int ch = raster.channels();
        int n = raster.pixelCount();

        long sumR = 0, sumG = 0, sumB = 0;
        long sqR = 0, sqG = 0, sqB = 0;
        for (int o = 0, end = n * ch; o < end; o += ch) {
            int r = data[o] & 0xFF;
            int g = data[o + 1] & 0xFF;
            int b = data[o + 2] & 0xFF;
            sumR += r;
            sumG += g;
            sumB += b;
            sqR += (long) r * r;
            sqG += (long) g * g;
            sqB += (long) b * b;
        }

        return PhotoStatistics.of(
                channel(sumR, sqR, n),
                channel(sumG, sqG, n),
                channel(sumB, sqB, n),
                thresholds);
    }

    /**
     * Basic statistics plus sharpness, saturation, dynamic range and noise.
     *
     * @throws UnsupportedFormatException if the raster is neither RGB nor RGBA
     * @throws InvalidDimensionsException if width or height is zero
     */
    public DetailedStatistics analyzeDetailed(RasterImage raster) {
        PhotoStatistics basic = analyze(raster);
        int w = raster.width();
        int h = raster.height();

        // 1. Luma plane + dynamic range
        int[] luma = PixelKernels.lumaPlane(raster);
        int min = 255;
        int max = 0;
        for (int v : luma) {
            if (v < min) min = v;
            if (v > max) max = v;
        }

        // 2. Sharpness: variance of the valid Laplacian response
        double sharpness = laplacianVariance(luma, w, h);

        // 3. Saturation
        double saturation = meanSaturation(raster);

        // 4. Noise residual
        double noise = noiseLevel(luma, w, h);

        return new DetailedStatistics(basic, sharpness, saturation, max - min, noise);
    }

    /**
     * Reject rasters the kernels cannot process, naming {@code step} in the error.
     *
     * @throws UnsupportedFormatException if the raster is neither RGB nor RGBA
     * @throws InvalidDimensionsException if width or height is zero
     */
    static void validate(RasterImage raster, String step) {
        if (raster.channels() != RasterImage.RGB && raster.channels() != RasterImage.RGBA) {
            throw new UnsupportedFormatException(step, raster.channels());
        }
        if (raster.width() == 0 || raster.height() == 0) {
            throw new InvalidDimensionsException(step, raster.width(), raster.height());
        }
    }

    private static ChannelStatistics channel(long sum, long sumSq, int n) {
        double mean = (double) sum / n;
        double variance = (double) sumSq / n - mean * mean;
        return new ChannelStatistics(mean, variance > 0 ? Math.sqrt(variance) : 0.0);
    }

    /**
     * Kernel [[0,1,0],[1,-4,1],[0,1,0]], no padding: output is (h-2)×(w-2).
     * Returns 0 when the valid region is empty.
     */
    static double laplacianVariance(int[] luma, int w, int h) {
        if (w < 3 || h < 3) {
            return 0.0;
        }
        long count = (long) (w - 2) * (h - 2);
        double sum = 0;
        double sumSq = 0;
        for (int y = 1; y < h - 1; y++) {
            int row = y * w;
            for (int x = 1; x < w - 1; x++) {
                int i = row + x;
                int lap = luma[i - w] + luma[i + w] + luma[i - 1] + luma[i + 1] - 4 * luma[i];
                sum += lap;
                sumSq += (double) lap * lap;
            }
        }
        double mean = sum / count;
        double variance = sumSq / count - mean * mean;
        return Math.max(0.0, variance);
    }

    static double meanSaturation(RasterImage raster) {
        byte[] data = raster.data();
        int ch = raster.channels();
        int n = raster.pixelCount();
        double sum = 0;
        for (int o = 0, end = n * ch; o < end; o += ch) {
            int r = data[o] & 0xFF;
            int g = data[o + 1] & 0xFF;
            int b = data[o + 2] & 0xFF;
            int max = Math.max(r, Math.max(g, b));
            if (max == 0) continue;
            int min = Math.min(r, Math.min(g, b));
            sum += 255.0 * (max - min) / max;
        }
        return sum / n;
    }

    /**
     * Std-dev of luma minus its 3×3 box blur; edges mirrored (symmetric mode).
     */
    static double noiseLevel(int[] luma, int w, int h) {
        int n = w * h;
        double sum = 0;
        double sumSq = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int box = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    int sy = mirror(y + dy, h);
                    for (int dx = -1; dx <= 1; dx++) {
                        box += luma[sy * w + mirror(x + dx, w)];
                    }
                }
                double residual = luma[y * w + x] - box / 9.0;
                sum += residual;
                sumSq += residual * residual;
            }
        }
        double mean = sum / n;
        double variance = sumSq / n - mean * mean;
        return variance > 0 ? Math.sqrt(variance) : 0.0;
    }

    // Symmetric reflection: -1 -> 0, len -> len - 1
    private static int mirror(int i, int len) {
        if (i < 0) return -i - 1;
        if (i >= len) return 2 * len - i - 1;
        return i;
    }
}
