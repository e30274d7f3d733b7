package com.dcruver.flowscript.query.result;

/**
 * Blocker urgency bucket derived from the impact score.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    public static Priority forScore(int impactScore) {
        if (impactScore > 10) {
            return HIGH;
        }
        return impactScore >= 5 ? MEDIUM : LOW;
    }
}
