package com.flowmable.enhancer;

/**
 * Thrown when a caller aborts a run at a stage boundary.
 * No partially enhanced raster is returned.
 */
public final class EnhancementCancelledException extends EnhancementException {

    public EnhancementCancelledException(StageType nextStage) {
        super(nextStage.key(), "Enhancement aborted before stage " + nextStage.displayName());
    }
}
