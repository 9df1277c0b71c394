package com.flowmable.enhancer;

/**
 * Thrown when a raster has zero width or height.
 */
public final class InvalidDimensionsException extends EnhancementException {

    public InvalidDimensionsException(String stage, int width, int height) {
        super(stage, "Invalid raster dimensions: " + width + "x" + height);
    }
}
