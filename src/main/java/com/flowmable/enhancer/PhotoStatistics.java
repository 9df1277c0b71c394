package com.flowmable.enhancer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Basic photometric statistics of an RGB raster.
 * <p>
 * Immutable; computed once per analysis call. The boolean flags are derived
 * from the flag thresholds of {@link EnhancementThresholds}, not from the
 * severity bands.
 *
 * @param red            Red channel statistics
 * @param green          Green channel statistics
 * @param blue           Blue channel statistics
 * @param brightness     Mean of the three channel means
 * @param contrast       Mean of the three channel standard deviations
 * @param greenDominance Green mean minus the average of red and blue means
 * @param hasGreenCast   {@code greenDominance > greenCastAbove}
 * @param underexposed   {@code brightness < underexposedBelow}
 * @param overexposed    {@code brightness > overexposedAbove}
 */
public record PhotoStatistics(
        ChannelStatistics red,
        ChannelStatistics green,
        ChannelStatistics blue,
        double brightness,
        double contrast,
        double greenDominance,
        boolean hasGreenCast,
        boolean underexposed,
        boolean overexposed
) {
    /**
     * Derive the aggregate values and flags from per-channel statistics.
     */
    public static PhotoStatistics of(ChannelStatistics red, ChannelStatistics green,
                                     ChannelStatistics blue, EnhancementThresholds thresholds) {
        double brightness = (red.mean() + green.mean() + blue.mean()) / 3.0;
        double contrast = (red.stdDev() + green.stdDev() + blue.stdDev()) / 3.0;
        double greenDominance = green.mean() - (red.mean() + blue.mean()) / 2.0;
        return new PhotoStatistics(
                red, green, blue,
                brightness, contrast, greenDominance,
                greenDominance > thresholds.greenCastAbove(),
                brightness < thresholds.underexposedBelow(),
                brightness > thresholds.overexposedAbove()
        );
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("r_mean", round2(red.mean()));
        map.put("g_mean", round2(green.mean()));
        map.put("b_mean", round2(blue.mean()));
        map.put("r_std", round2(red.stdDev()));
        map.put("g_std", round2(green.stdDev()));
        map.put("b_std", round2(blue.stdDev()));
        map.put("overall_brightness", round2(brightness));
        map.put("overall_contrast", round2(contrast));
        map.put("green_dominance", round2(greenDominance));
        map.put("has_green_cast", hasGreenCast);
        map.put("is_underexposed", underexposed);
        map.put("is_overexposed", overexposed);
        return map;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
