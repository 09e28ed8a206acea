package com.loanorigination.rules;

/**
 * Weight of a rule outcome. POSITIVE marks favourable signals.
 */
public enum Severity {
    POSITIVE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * A failed outcome at this severity rejects the application outright.
     */
    public boolean isBlocking() {
        return this == HIGH || this == CRITICAL;
    }
}
