package com.flowmable.enhancer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Brightness correction: every colour channel multiplied by {@code factor}.
 *
 * @param factor   Multiplier, resolved at plan time
 * @param adaptive True when derived from measured brightness, false for the gentle fixed factor
 */
public record ExposureStage(double factor, boolean adaptive) implements EnhancementStage {

    @Override
    public StageType type() {
        return StageType.EXPOSURE;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        double f = factor;
        return PixelKernels.mapPixels(input, (r, g, b, dst, o) -> {
            dst[o] = (byte) PixelKernels.clampRound(r * f);
            dst[o + 1] = (byte) PixelKernels.clampRound(g * f);
            dst[o + 2] = (byte) PixelKernels.clampRound(b * f);
        });
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("factor", factor);
        map.put("adaptive", adaptive);
        return map;
    }
}
