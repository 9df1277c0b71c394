package com.flowmable.enhancer;

import java.util.Map;

/**
 * S-curve tone mapping through a fixed 256-entry lookup table,
 * {@code 255 * 0.5 * (1 + tanh(2.5 * (i/255 - 0.5)))}, truncated.
 * Applied identically to R, G and B.
 */
public record ToneCurveStage() implements EnhancementStage {

    static final double STEEPNESS = 2.5;

    private static final int[] LUT = buildLut();

    private static int[] buildLut() {
        int[] lut = new int[256];
        for (int i = 0; i < 256; i++) {
            double t = i / 255.0;
            lut[i] = PixelKernels.clampTruncate(255.0 * 0.5 * (1.0 + Math.tanh(STEEPNESS * (t - 0.5))));
        }
        return lut;
    }

    /** Copy of the lookup table. */
    public static int[] lookupTable() {
        return LUT.clone();
    }

    @Override
    public StageType type() {
        return StageType.TONE_CURVE;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        return PixelKernels.mapPixels(input, (r, g, b, dst, o) -> {
            dst[o] = (byte) LUT[r];
            dst[o + 1] = (byte) LUT[g];
            dst[o + 2] = (byte) LUT[b];
        });
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("steepness", STEEPNESS);
    }
}
