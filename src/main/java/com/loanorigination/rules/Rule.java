package com.loanorigination.rules;

import com.loanorigination.exception.RuleDefinitionException;

/**
 * Immutable rule definition.
 *
 * @param id        unique within an engine
 * @param name      human-readable name, defaults to the id
 * @param condition predicate over the snapshot
 * @param action    what happens when the condition holds
 * @param severity  defaults to MEDIUM
 * @param score     signed contribution added when the condition holds
 * @param message   explanation attached to the outcome
 */
public record Rule<S extends RuleSnapshot>(
        String id,
        String name,
        Condition<S> condition,
        RuleAction action,
        Severity severity,
        int score,
        String message
) {
    public Rule {
        if (id == null || id.isBlank()) {
            throw new RuleDefinitionException("Rule must have id, condition, and action properties");
        }
        if (condition == null) {
            throw new RuleDefinitionException("Rule " + id + " has no condition");
        }
        if (action == null) {
            throw new RuleDefinitionException("Rule " + id + " has no action");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (severity == null) {
            severity = Severity.MEDIUM;
        }
        if (message == null) {
            message = "";
        }
    }

    public static <S extends RuleSnapshot> Rule<S> of(String id, String name, RuleAction action,
                                                      Severity severity, int score, String message,
                                                      Condition<S> condition) {
        return new Rule<>(id, name, condition, action, severity, score, message);
    }

    /**
     * Same as {@link #of} with a textual condition.
     */
    public static <S extends RuleSnapshot> Rule<S> of(String id, String name, RuleAction action,
                                                      Severity severity, int score, String message,
                                                      String expression) {
        return new Rule<>(id, name, Condition.expression(expression), action, severity, score, message);
    }
}
