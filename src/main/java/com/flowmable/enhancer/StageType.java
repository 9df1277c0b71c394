package com.flowmable.enhancer;

/**
 * The eight enhancement stages in pipeline order.
 */
public enum StageType {
    EXPOSURE("exposure", "Adaptive Exposure Correction"),
    CONTRAST("contrast", "Contrast Enhancement"),
    TONE_CURVE("tone_curve", "S-Curve Tone Mapping"),
    COLOR_CAST_REMOVAL("color_cast_removal", "Green Cast Removal"),
    COLOR_GRADING("color_grading", "Cinematic Color Grading"),
    SATURATION("saturation", "Saturation Optimization"),
    SHARPENING("sharpening", "Professional Sharpening"),
    VIGNETTE("vignette", "Cinematic Vignette");

    private final String key;
    private final String displayName;

    StageType(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }
}
