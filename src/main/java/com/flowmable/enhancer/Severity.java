package com.flowmable.enhancer;

import java.util.Locale;

/**
 * Four-tier severity of a metric's deviation from its acceptable band.
 * Declaration order is the severity order: GOOD &lt; MILD &lt; MODERATE &lt; SEVERE.
 */
public enum Severity {
    /** Within the acceptable band. No penalty. */
    GOOD(0),
    /** Slightly off. Penalty 5. */
    MILD(5),
    /** Clearly off. Penalty 12. */
    MODERATE(12),
    /** Far off. Penalty 20. */
    SEVERE(20);

    private final int penalty;

    Severity(int penalty) {
        this.penalty = penalty;
    }

    /** Points subtracted from the quality score. */
    public int penalty() {
        return penalty;
    }

    /** Lower-case name used in reports ("good", "mild", ...). */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
