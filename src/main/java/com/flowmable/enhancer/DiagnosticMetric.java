package com.flowmable.enhancer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classified value of one metric.
 *
 * @param value    Measured value
 * @param severity Classification
 * @param label    Human-readable metric name
 * @param issue    Short issue description; null when severity is GOOD
 * @param detail   Measured value in words, e.g. "Average brightness 50.0 / 255"
 */
public record DiagnosticMetric(
        double value,
        Severity severity,
        String label,
        String issue,
        String detail
) {
    public boolean isGood() {
        return severity == Severity.GOOD;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("value", PhotoStatistics.round2(value));
        map.put("severity", severity.key());
        map.put("label", label);
        map.put("issue", issue);
        map.put("detail", detail);
        return map;
    }
}
