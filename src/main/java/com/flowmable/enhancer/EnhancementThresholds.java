package com.flowmable.enhancer;

/**
 * Configurable classification thresholds and statistic flags.
 * <p>
 * VERSION: 1.1
 * Any modification to defaults requires THRESHOLDS_VERSION increment.
 * <p>
 * All bounds are strict: "below" means {@code value < bound}, "above" means
 * {@code value > bound}.
 *
 * @param brightnessSevereBelow   Brightness below this is SEVERE (underexposed)
 * @param brightnessModerateBelow Brightness below this is MODERATE (underexposed)
 * @param brightnessSevereAbove   Brightness above this is SEVERE (overexposed)
 * @param brightnessModerateAbove Brightness above this is MODERATE (overexposed)
 * @param brightnessMildAbove     Brightness above this is MILD (bright)
 * @param contrastSevereBelow     Contrast below this is SEVERE
 * @param contrastModerateBelow   Contrast below this is MODERATE
 * @param contrastMildBelow       Contrast below this is MILD
 * @param castSevereAbove         Green dominance above this is SEVERE
 * @param castModerateAbove       Green dominance above this is MODERATE
 * @param castMildAbove           Green dominance above this is MILD
 * @param saturationSevereBelow   Mean saturation below this is SEVERE
 * @param saturationModerateBelow Mean saturation below this is MODERATE
 * @param saturationMildBelow     Mean saturation below this is MILD
 * @param saturationOverAbove     Mean saturation above this is MODERATE (oversaturated)
 * @param sharpnessSevereBelow    Laplacian variance below this is SEVERE
 * @param sharpnessModerateBelow  Laplacian variance below this is MODERATE
 * @param sharpnessMildBelow      Laplacian variance below this is MILD
 * @param rangeModerateBelow      Dynamic range below this is MODERATE
 * @param rangeMildBelow          Dynamic range below this is MILD
 * @param greenCastAbove          Green dominance above this sets the green-cast flag
 * @param underexposedBelow       Brightness below this sets the underexposed flag
 * @param overexposedAbove        Brightness above this sets the overexposed flag
 * @param saturationBrightAbove   Brightness above this gets the mild saturation boost
 */
public record EnhancementThresholds(
        double brightnessSevereBelow,
        double brightnessModerateBelow,
        double brightnessSevereAbove,
        double brightnessModerateAbove,
        double brightnessMildAbove,
        double contrastSevereBelow,
        double contrastModerateBelow,
        double contrastMildBelow,
        double castSevereAbove,
        double castModerateAbove,
        double castMildAbove,
        double saturationSevereBelow,
        double saturationModerateBelow,
        double saturationMildBelow,
        double saturationOverAbove,
        double sharpnessSevereBelow,
        double sharpnessModerateBelow,
        double sharpnessMildBelow,
        double rangeModerateBelow,
        double rangeMildBelow,
        double greenCastAbove,
        double underexposedBelow,
        double overexposedAbove,
        double saturationBrightAbove
) {
    public static final String THRESHOLDS_VERSION = "1.1";

    public static final EnhancementThresholds DEFAULT = new EnhancementThresholds(
            70.0,  // brightnessSevereBelow
            100.0, // brightnessModerateBelow
            200.0, // brightnessSevereAbove
            180.0, // brightnessModerateAbove
            160.0, // brightnessMildAbove
            35.0,  // contrastSevereBelow
            50.0,  // contrastModerateBelow
            65.0,  // contrastMildBelow
            25.0,  // castSevereAbove
            15.0,  // castModerateAbove
            8.0,   // castMildAbove
            40.0,  // saturationSevereBelow
            70.0,  // saturationModerateBelow
            90.0,  // saturationMildBelow
            200.0, // saturationOverAbove
            100.0, // sharpnessSevereBelow
            300.0, // sharpnessModerateBelow
            800.0, // sharpnessMildBelow
            100.0, // rangeModerateBelow
            150.0, // rangeMildBelow
            // Flags gate stages directly; kept apart from the cast severity bands
            15.0,  // greenCastAbove
            100.0, // underexposedBelow
            180.0, // overexposedAbove
            170.0  // saturationBrightAbove
    );
}
