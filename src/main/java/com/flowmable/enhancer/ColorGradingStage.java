package com.flowmable.enhancer;

import java.util.Map;

/**
 * Cinematic colour grade by luma band: cool shadows, warm midtones and
 * highlights.
 */
public record ColorGradingStage() implements EnhancementStage {

    static final double SHADOW_BELOW = 60.0;
    static final double HIGHLIGHT_FROM = 180.0;

    @Override
    public StageType type() {
        return StageType.COLOR_GRADING;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        return PixelKernels.mapPixels(input, (r, g, b, dst, o) -> {
            double lum = PixelKernels.luma(r, g, b);
            int nr, ng, nb;
            if (lum < SHADOW_BELOW) {
                nr = r;
                ng = g + 2;
                nb = b + 5;
            } else if (lum < HIGHLIGHT_FROM) {
                nr = r + 4;
                ng = g + 1;
                nb = b - 3;
            } else {
                nr = r + 3;
                ng = g + 1;
                nb = b - 2;
            }
            dst[o] = (byte) PixelKernels.clamp(nr);
            dst[o + 1] = (byte) PixelKernels.clamp(ng);
            dst[o + 2] = (byte) PixelKernels.clamp(nb);
        });
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("shadow_below", SHADOW_BELOW, "highlight_from", HIGHLIGHT_FROM);
    }
}
