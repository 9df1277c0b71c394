package com.flowmable.enhancer;

import java.util.Map;

/**
 * Basic statistics extended with the detail metrics used for classification.
 *
 * @param basic        Channel means, deviations and derived flags
 * @param sharpness    Variance of the valid 3×3 Laplacian of the luma plane
 * @param saturation   Mean HSV saturation, 0–255 scale
 * @param dynamicRange max(luma) − min(luma)
 * @param noiseLevel   Std-dev of luma minus its 3×3 box blur (diagnostic only)
 */
public record DetailedStatistics(
        PhotoStatistics basic,
        double sharpness,
        double saturation,
        int dynamicRange,
        double noiseLevel
) {
    public double brightness() {
        return basic.brightness();
    }

    public double contrast() {
        return basic.contrast();
    }

    public double greenDominance() {
        return basic.greenDominance();
    }

    public boolean hasGreenCast() {
        return basic.hasGreenCast();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = basic.toMap();
        map.put("sharpness", PhotoStatistics.round2(sharpness));
        map.put("saturation", PhotoStatistics.round2(saturation));
        map.put("dynamic_range", dynamicRange);
        map.put("noise_level", PhotoStatistics.round2(noiseLevel));
        return map;
    }
}
