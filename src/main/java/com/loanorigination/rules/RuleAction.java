package com.loanorigination.rules;

import java.util.Locale;

/**
 * What a rule does when its condition holds.
 */
public enum RuleAction {
    APPROVE,
    REJECT,
    FLAG,        // noted, does not change the decision
    CONDITIONAL; // approval subject to conditions

    public OutcomeBucket bucket() {
        return switch (this) {
            case APPROVE -> OutcomeBucket.PASSED;
            case REJECT -> OutcomeBucket.FAILED;
            case FLAG -> OutcomeBucket.WARNINGS;
            case CONDITIONAL -> OutcomeBucket.FLAGS;
        };
    }

    /**
     * Parses the textual action names used in rule definitions, including
     * the aliases {@code pass}, {@code fail} and {@code warning}.
     */
    public static RuleAction fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rule action cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "approve", "pass" -> APPROVE;
            case "reject", "fail" -> REJECT;
            case "flag", "warning" -> FLAG;
            case "conditional" -> CONDITIONAL;
            default -> throw new IllegalArgumentException("Unknown rule action: " + value);
        };
    }
}
