package com.flowmable.enhancer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of classifying one raster's statistics.
 *
 * @param metrics         Classified metrics in {@link Metric} order
 * @param overallScore    100 minus severity penalties, clamped to [0, 100]
 * @param issuesFound     Number of metrics not classified GOOD
 * @param recommendations Ordered enhancement suggestions
 */
public record DiagnosticsReport(
        Map<Metric, DiagnosticMetric> metrics,
        int overallScore,
        int issuesFound,
        List<Recommendation> recommendations
) {
    public DiagnosticsReport {
        // EnumMap(Map) rejects an empty non-EnumMap source
        Map<Metric, DiagnosticMetric> copy = new EnumMap<>(Metric.class);
        copy.putAll(metrics);
        metrics = Collections.unmodifiableMap(copy);
        recommendations = List.copyOf(recommendations);
    }

    public DiagnosticMetric metric(Metric metric) {
        return metrics.get(metric);
    }

    public Severity severity(Metric metric) {
        return metrics.get(metric).severity();
    }

    /** One-line verdict for the score band. */
    public String summary() {
        if (overallScore >= 85) return "Great photo! Only minor tweaks needed.";
        if (overallScore >= 65) return "Good photo with some areas to improve.";
        if (overallScore >= 45) return "Several issues detected, enhancement recommended.";
        return "Significant issues found, enhancement strongly recommended.";
    }

    /** Metrics and score only. */
    public Map<String, Object> toScoreMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("metrics", metricsMap());
        map.put("overall_score", overallScore);
        return map;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = toScoreMap();
        map.put("issues_found", issuesFound);
        map.put("total_metrics", metrics.size());
        map.put("summary", summary());
        List<Map<String, Object>> recs = new ArrayList<>(recommendations.size());
        for (Recommendation r : recommendations) {
            recs.add(r.toMap());
        }
        map.put("recommendations", recs);
        return map;
    }

    private Map<String, Object> metricsMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<Metric, DiagnosticMetric> e : metrics.entrySet()) {
            out.put(e.getKey().key(), e.getValue().toMap());
        }
        return out;
    }
}
