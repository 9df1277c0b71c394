package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps detailed statistics to per-metric severities, a 0–100 quality score
 * and an ordered recommendation list.
 * <p>
 * Each table is evaluated first-match in the order written below. Pure
 * function of its input and the injected thresholds.
 */
public class SeverityClassifier {

    static final String GRADING_ACTION = "Cinematic Color Grading";
    static final String GRADING_REASON = "Adds warm midtones and cool shadows for a cinematic look";
    static final String VIGNETTE_ACTION = "Cinematic Vignette";
    static final String VIGNETTE_REASON = "Draws the eye toward the center of the frame";

    private final EnhancementThresholds thresholds;

    public SeverityClassifier() {
        this(EnhancementThresholds.DEFAULT);
    }

    public SeverityClassifier(EnhancementThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public DiagnosticsReport classify(DetailedStatistics stats) {
        Map<Metric, DiagnosticMetric> metrics = new EnumMap<>(Metric.class);
        metrics.put(Metric.BRIGHTNESS, brightness(stats.brightness()));
        metrics.put(Metric.CONTRAST, contrast(stats.contrast()));
        metrics.put(Metric.COLOR_CAST, colorCast(stats.greenDominance()));
        metrics.put(Metric.SATURATION, saturation(stats.saturation()));
        metrics.put(Metric.SHARPNESS, sharpness(stats.sharpness()));
        metrics.put(Metric.DYNAMIC_RANGE, dynamicRange(stats.dynamicRange()));

        int penalty = 0;
        int issues = 0;
        List<Recommendation> recommendations = new ArrayList<>();
        for (Map.Entry<Metric, DiagnosticMetric> e : metrics.entrySet()) {
            DiagnosticMetric m = e.getValue();
            penalty += m.severity().penalty();
            if (!m.isGood()) {
                issues++;
                recommendations.add(new Recommendation(e.getKey().action(), m.issue()));
            }
        }
        recommendations.add(new Recommendation(GRADING_ACTION, GRADING_REASON));
        if (metrics.get(Metric.COLOR_CAST).isGood()) {
            recommendations.add(new Recommendation(VIGNETTE_ACTION, VIGNETTE_REASON));
        }

        int score = Math.max(0, Math.min(100, 100 - penalty));
        return new DiagnosticsReport(metrics, score, issues, recommendations);
    }

    DiagnosticMetric brightness(double v) {
        String detail = String.format(Locale.ROOT, "Average brightness %.1f / 255", v);
        if (v < thresholds.brightnessSevereBelow()) {
            return issue(Metric.BRIGHTNESS, v, Severity.SEVERE, "Severely underexposed (too dark)", detail);
        }
        if (v < thresholds.brightnessModerateBelow()) {
            return issue(Metric.BRIGHTNESS, v, Severity.MODERATE, "Underexposed", detail);
        }
        if (v > thresholds.brightnessSevereAbove()) {
            return issue(Metric.BRIGHTNESS, v, Severity.SEVERE, "Severely overexposed (too bright)", detail);
        }
        if (v > thresholds.brightnessModerateAbove()) {
            return issue(Metric.BRIGHTNESS, v, Severity.MODERATE, "Overexposed", detail);
        }
        if (v > thresholds.brightnessMildAbove()) {
            return issue(Metric.BRIGHTNESS, v, Severity.MILD, "Slightly bright", detail);
        }
        return good(Metric.BRIGHTNESS, v, detail);
    }

    DiagnosticMetric contrast(double v) {
        String detail = String.format(Locale.ROOT, "Average channel deviation %.1f", v);
        if (v < thresholds.contrastSevereBelow()) {
            return issue(Metric.CONTRAST, v, Severity.SEVERE, "Very flat, washed-out image", detail);
        }
        if (v < thresholds.contrastModerateBelow()) {
            return issue(Metric.CONTRAST, v, Severity.MODERATE, "Low contrast", detail);
        }
        if (v < thresholds.contrastMildBelow()) {
            return issue(Metric.CONTRAST, v, Severity.MILD, "Slightly flat contrast", detail);
        }
        return good(Metric.CONTRAST, v, detail);
    }

    DiagnosticMetric colorCast(double v) {
        String detail = String.format(Locale.ROOT, "Green dominance %+.1f", v);
        if (v > thresholds.castSevereAbove()) {
            return issue(Metric.COLOR_CAST, v, Severity.SEVERE, "Strong green color cast", detail);
        }
        if (v > thresholds.castModerateAbove()) {
            return issue(Metric.COLOR_CAST, v, Severity.MODERATE, "Noticeable green color cast", detail);
        }
        if (v > thresholds.castMildAbove()) {
            return issue(Metric.COLOR_CAST, v, Severity.MILD, "Slight green tint", detail);
        }
        return good(Metric.COLOR_CAST, v, detail);
    }

    DiagnosticMetric saturation(double v) {
        String detail = String.format(Locale.ROOT, "Average saturation %.1f / 255", v);
        if (v < thresholds.saturationSevereBelow()) {
            return issue(Metric.SATURATION, v, Severity.SEVERE, "Colors are almost gray", detail);
        }
        if (v < thresholds.saturationModerateBelow()) {
            return issue(Metric.SATURATION, v, Severity.MODERATE, "Dull, desaturated colors", detail);
        }
        if (v < thresholds.saturationMildBelow()) {
            return issue(Metric.SATURATION, v, Severity.MILD, "Slightly muted colors", detail);
        }
        if (v > thresholds.saturationOverAbove()) {
            return issue(Metric.SATURATION, v, Severity.MODERATE, "Oversaturated colors", detail);
        }
        return good(Metric.SATURATION, v, detail);
    }

    DiagnosticMetric sharpness(double v) {
        String detail = String.format(Locale.ROOT, "Laplacian variance %.1f", v);
        if (v < thresholds.sharpnessSevereBelow()) {
            return issue(Metric.SHARPNESS, v, Severity.SEVERE, "Very blurry", detail);
        }
        if (v < thresholds.sharpnessModerateBelow()) {
            return issue(Metric.SHARPNESS, v, Severity.MODERATE, "Soft focus", detail);
        }
        if (v < thresholds.sharpnessMildBelow()) {
            return issue(Metric.SHARPNESS, v, Severity.MILD, "Could be sharper", detail);
        }
        return good(Metric.SHARPNESS, v, detail);
    }

    DiagnosticMetric dynamicRange(int v) {
        String detail = "Luma range " + v + " / 255";
        if (v < thresholds.rangeModerateBelow()) {
            return issue(Metric.DYNAMIC_RANGE, v, Severity.MODERATE, "Narrow tonal range", detail);
        }
        if (v < thresholds.rangeMildBelow()) {
            return issue(Metric.DYNAMIC_RANGE, v, Severity.MILD, "Limited tonal range", detail);
        }
        return good(Metric.DYNAMIC_RANGE, v, detail);
    }

    private static DiagnosticMetric issue(Metric metric, double value, Severity severity,
                                          String issue, String detail) {
        return new DiagnosticMetric(value, severity, metric.label(), issue, detail);
    }

    private static DiagnosticMetric good(Metric metric, double value, String detail) {
        return new DiagnosticMetric(value, Severity.GOOD, metric.label(), null, detail);
    }
}
