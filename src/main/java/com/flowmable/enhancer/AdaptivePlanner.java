package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses the enhancement stages and resolves their parameters from the
 * measured statistics and their classification.
 * <p>
 * Stage order is fixed: exposure, contrast, tone curve, colour-cast removal,
 * colour grading, saturation, sharpening, vignette. Colour-cast removal and
 * vignette are gated on the raw green-cast flag, not on the colour-cast
 * severity, so exactly one of the two runs.
 */
public class AdaptivePlanner {

    static final double GENTLE_EXPOSURE = 1.02;
    static final double NEUTRAL_EXPOSURE = 1.05;
    static final double MAX_BRIGHTEN = 1.35;
    static final double MAX_DARKEN = 0.85;

    static final double FIXED_CONTRAST = 1.05;

    private final EnhancementThresholds thresholds;

    public AdaptivePlanner() {
        this(EnhancementThresholds.DEFAULT);
    }

    public AdaptivePlanner(EnhancementThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public EnhancementPlan plan(DetailedStatistics stats, DiagnosticsReport report) {
        List<EnhancementStage> stages = new ArrayList<>(8);

        // 1. Exposure
        if (report.severity(Metric.BRIGHTNESS) != Severity.GOOD) {
            stages.add(new ExposureStage(exposureFactor(stats.basic()), true));
        } else {
            stages.add(new ExposureStage(GENTLE_EXPOSURE, false));
        }

        // 2. Contrast
        if (report.severity(Metric.CONTRAST) != Severity.GOOD) {
            stages.add(new ContrastStage(contrastFactor(stats.contrast()), true));
        } else {
            stages.add(new ContrastStage(FIXED_CONTRAST, false));
        }

        // 3. Tone curve
        if (report.severity(Metric.DYNAMIC_RANGE) != Severity.GOOD) {
            stages.add(new ToneCurveStage());
        }

        // 4. Colour-cast removal
        if (stats.hasGreenCast()) {
            stages.add(ColorCastRemovalStage.forGreenDominance(stats.greenDominance()));
        }

        // 5. Colour grading
        stages.add(new ColorGradingStage());

        // 6. Saturation (no fixed fallback)
        if (report.severity(Metric.SATURATION) != Severity.GOOD) {
            stages.add(new SaturationStage(saturationFactor(stats.basic())));
        }

        // 7. Sharpening
        stages.add(report.severity(Metric.SHARPNESS) != Severity.GOOD
                ? SharpeningStage.STRONG
                : SharpeningStage.GENTLE);

        // 8. Vignette
        if (!stats.hasGreenCast()) {
            stages.add(new VignetteStage());
        }

        return new EnhancementPlan(stats, report, stages);
    }

    static double exposureFactor(PhotoStatistics stats) {
        double brightness = stats.brightness();
        if (stats.underexposed()) {
            return Math.min(1.0 + (128.0 - brightness) / 256.0, MAX_BRIGHTEN);
        }
        if (stats.overexposed()) {
            return Math.max(1.0 - (brightness - 128.0) / 384.0, MAX_DARKEN);
        }
        return NEUTRAL_EXPOSURE;
    }

    // Bands shared with the contrast severity table
    double contrastFactor(double contrast) {
        if (contrast < thresholds.contrastModerateBelow()) return 1.30;
        if (contrast < thresholds.contrastMildBelow()) return 1.18;
        return 1.08;
    }

    double saturationFactor(PhotoStatistics stats) {
        if (stats.hasGreenCast()) return 1.10;
        if (stats.brightness() < thresholds.underexposedBelow()) return 1.20;
        if (stats.brightness() > thresholds.saturationBrightAbove()) return 1.05;
        return 1.15;
    }
}
