package com.flowmable.enhancer;

import java.util.Map;

/**
 * Radial darkening. Pixels within 60% of the centre-to-corner distance keep
 * full brightness; beyond it the mask falls off linearly to a floor of 140/255.
 */
public record VignetteStage() implements EnhancementStage {

    static final double INNER_RATIO = 0.6;
    static final double FALLOFF = 160.0;
    static final int FLOOR = 140;

    /** Mask value (0..255) at a given fraction of the maximum radius. */
    static int darkness(double ratio) {
        if (ratio <= INNER_RATIO) {
            return 255;
        }
        return Math.max(FLOOR, (int) (255 - (ratio - INNER_RATIO) * FALLOFF));
    }

    @Override
    public StageType type() {
        return StageType.VIGNETTE;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        int w = input.width();
        int ch = input.channels();
        int cx = w / 2;
        int cy = input.height() / 2;
        double maxR = Math.sqrt((double) cx * cx + (double) cy * cy);
        if (maxR == 0) {
            return input.copy();
        }
        RasterImage out = input.blankLike();
        byte[] src = input.data();
        byte[] dst = out.data();
        PixelKernels.forEachRow(input, y -> {
            double dy = y - cy;
            int o = y * w * ch;
            for (int x = 0; x < w; x++, o += ch) {
                double dx = x - cx;
                double scale = darkness(Math.sqrt(dx * dx + dy * dy) / maxR) / 255.0;
                dst[o] = (byte) PixelKernels.clampRound((src[o] & 0xFF) * scale);
                dst[o + 1] = (byte) PixelKernels.clampRound((src[o + 1] & 0xFF) * scale);
                dst[o + 2] = (byte) PixelKernels.clampRound((src[o + 2] & 0xFF) * scale);
            }
        });
        return out;
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("inner_ratio", INNER_RATIO, "floor", FLOOR);
    }
}
