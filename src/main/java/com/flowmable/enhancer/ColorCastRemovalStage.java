package com.flowmable.enhancer;

import java.util.Map;

/**
 * Green cast removal. Shifts red and blue up and green down by fractions of
 * {@code correction}; chroma-key pixels (a green backdrop) are left as they are.
 *
 * @param correction Strength, {@code min(greenDominance * 0.4, 25)} at plan time
 */
public record ColorCastRemovalStage(double correction) implements EnhancementStage {

    static final double STRENGTH = 0.4;
    static final double MAX_CORRECTION = 25.0;

    static final double RED_SHARE = 0.2;
    static final double GREEN_SHARE = 0.6;
    static final double BLUE_SHARE = 0.15;

    // Chroma key: bright green clearly above both other channels
    static final int KEY_MIN_GREEN = 150;
    static final double KEY_RATIO = 1.5;

    public static ColorCastRemovalStage forGreenDominance(double greenDominance) {
        return new ColorCastRemovalStage(Math.min(greenDominance * STRENGTH, MAX_CORRECTION));
    }

    static boolean isChromaKey(int r, int g, int b) {
        return g > KEY_MIN_GREEN && g > r * KEY_RATIO && g > b * KEY_RATIO;
    }

    @Override
    public StageType type() {
        return StageType.COLOR_CAST_REMOVAL;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        double dr = correction * RED_SHARE;
        double dg = correction * GREEN_SHARE;
        double db = correction * BLUE_SHARE;
        return PixelKernels.mapPixels(input, (r, g, b, dst, o) -> {
            if (isChromaKey(r, g, b)) {
                dst[o] = (byte) r;
                dst[o + 1] = (byte) g;
                dst[o + 2] = (byte) b;
                return;
            }
            dst[o] = (byte) PixelKernels.clampTruncate(r + dr);
            dst[o + 1] = (byte) PixelKernels.clampTruncate(g - dg);
            dst[o + 2] = (byte) PixelKernels.clampTruncate(b + db);
        });
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("correction", correction);
    }
}
