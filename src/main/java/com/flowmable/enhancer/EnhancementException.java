package com.flowmable.enhancer;

/**
 * Base exception for failures inside the diagnostics and enhancement core.
 *
 * <p>Every failure names the step it happened in: {@code "analysis"} for
 * statistics extraction, or the key of the stage that was about to run.</p>
 */
public class EnhancementException extends RuntimeException {

    private final String stage;

    /**
     * Constructs a new exception for the given step.
     *
     * @param stage the step that failed
     * @param message the detail message
     */
    public EnhancementException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    /**
     * Constructs a new exception for the given step with a cause.
     *
     * @param stage the step that failed
     * @param message the detail message
     * @param cause the underlying failure
     */
    public EnhancementException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    /**
     * @return the step that failed
     */
    public String stage() {
        return stage;
    }
}
