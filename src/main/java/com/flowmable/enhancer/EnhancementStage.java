package com.flowmable.enhancer;

import java.util.Map;

/**
 * One pixel-level transform with parameters frozen at plan time.
 * <p>
 * Implementations are deterministic, never mutate their input, pass alpha
 * through unchanged and clamp every written channel to 0..255.
 */
public interface EnhancementStage {

    StageType type();

    /**
     * Apply the transform.
     *
     * @param input RGB or RGBA raster (caller keeps ownership)
     * @return a new raster holding the result
     */
    RasterImage apply(RasterImage input);

    /** Resolved parameters, for reports. */
    Map<String, Object> parameters();
}
