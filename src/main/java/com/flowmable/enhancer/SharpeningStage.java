package com.flowmable.enhancer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unsharp mask: {@code out = in + percent/100 * (in - gaussianBlur(in, radius))},
 * applied per channel only where {@code |in - blurred| >= threshold}.
 *
 * @param radius    Gaussian standard deviation in pixels
 * @param percent   Strength of the added residual
 * @param threshold Minimum residual that gets sharpened
 */
public record SharpeningStage(double radius, int percent, int threshold) implements EnhancementStage {

    /** Used when sharpness is not GOOD. */
    public static final SharpeningStage STRONG = new SharpeningStage(1.5, 80, 3);
    /** Used when sharpness is GOOD. */
    public static final SharpeningStage GENTLE = new SharpeningStage(0.8, 40, 4);

    @Override
    public StageType type() {
        return StageType.SHARPENING;
    }

    @Override
    public RasterImage apply(RasterImage input) {
        RasterImage blurred = PixelKernels.gaussianBlur(input, radius);
        RasterImage out = input.blankLike();
        byte[] src = input.data();
        byte[] blur = blurred.data();
        byte[] dst = out.data();
        int w = input.width();
        int ch = input.channels();
        double amount = percent / 100.0;
        PixelKernels.forEachRow(input, y -> {
            for (int o = y * w * ch, end = o + w * ch; o < end; o += ch) {
                for (int c = 0; c < 3; c++) {
                    int v = src[o + c] & 0xFF;
                    int diff = v - (blur[o + c] & 0xFF);
                    dst[o + c] = Math.abs(diff) >= threshold
                            ? (byte) PixelKernels.clampRound(v + amount * diff)
                            : (byte) v;
                }
            }
        });
        return out;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("radius", radius);
        map.put("percent", percent);
        map.put("threshold", threshold);
        return map;
    }
}
