package com.flowmable.enhancer;

/**
 * The six tracked diagnostic metrics, in report order.
 */
public enum Metric {
    BRIGHTNESS("brightness", "Brightness", "Adaptive Exposure Correction"),
    CONTRAST("contrast", "Contrast", "Contrast Enhancement"),
    COLOR_CAST("color_cast", "Color Cast", "Green Cast Removal"),
    SATURATION("saturation", "Saturation", "Saturation Optimization"),
    SHARPNESS("sharpness", "Sharpness", "Professional Sharpening"),
    DYNAMIC_RANGE("dynamic_range", "Dynamic Range", "S-Curve Tone Mapping");

    private final String key;
    private final String label;
    private final String action;

    Metric(String key, String label, String action) {
        this.key = key;
        this.label = label;
        this.action = action;
    }

    /** Report key, e.g. {@code color_cast}. */
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    /** Recommendation action emitted when the metric is not GOOD. */
    public String action() {
        return action;
    }
}
