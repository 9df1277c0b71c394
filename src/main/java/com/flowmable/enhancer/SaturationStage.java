package com.flowmable.enhancer;

import java.util.Map;

/**
 * Scales each pixel's chroma, its distance from its own luma, by {@code factor}.
 *
 * @param factor Chroma multiplier, resolved at plan time
 */
public record SaturationStage(double factor) implements EnhancementStage {

    @Override
    public StageType type() {
        return StageType.SATURATION;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        double f = factor;
        return PixelKernels.mapPixels(input, (r, g, b, dst, o) -> {
            double lum = PixelKernels.luma(r, g, b);
            dst[o] = (byte) PixelKernels.clampRound(lum + (r - lum) * f);
            dst[o + 1] = (byte) PixelKernels.clampRound(lum + (g - lum) * f);
            dst[o + 2] = (byte) PixelKernels.clampRound(lum + (b - lum) * f);
        });
    }

    @Override
    public Map<String, Object> parameters() {
        return Map.of("factor", factor);
    }
}
