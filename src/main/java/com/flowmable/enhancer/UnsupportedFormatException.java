package com.flowmable.enhancer;

/**
 * Thrown when a raster's channel layout is neither RGB nor RGBA.
 */
public final class UnsupportedFormatException extends EnhancementException {

    private final int channels;

    public UnsupportedFormatException(String stage, int channels) {
        super(stage, "Unsupported channel layout: " + channels
                + " channel(s), expected RGB (3) or RGBA (4)");
        this.channels = channels;
    }

    public int channels() {
        return channels;
    }
}
