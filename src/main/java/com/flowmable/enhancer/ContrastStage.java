package com.flowmable.enhancer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linear stretch around mid-gray: {@code out = 128 + (in - 128) * factor}.
 *
 * @param factor   Stretch factor, resolved at plan time
 * @param adaptive True when derived from measured contrast, false for the fixed factor
 */
public record ContrastStage(double factor, boolean adaptive) implements EnhancementStage {

    static final double MID_GRAY = 128.0;

    @Override
    public StageType type() {
        return StageType.CONTRAST;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        double f = factor;
        return PixelKernels.mapPixels(input, (r, g, b, dst, o) -> {
            dst[o] = (byte) PixelKernels.clampRound(MID_GRAY + (r - MID_GRAY) * f);
            dst[o + 1] = (byte) PixelKernels.clampRound(MID_GRAY + (g - MID_GRAY) * f);
            dst[o + 2] = (byte) PixelKernels.clampRound(MID_GRAY + (b - MID_GRAY) * f);
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
