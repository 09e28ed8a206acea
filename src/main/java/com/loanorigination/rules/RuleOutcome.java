package com.loanorigination.rules;

/**
 * Result of one rule in one execution.
 *
 * @param error set only when the condition itself failed; such outcomes are
 *              always in the failed bucket with HIGH severity
 */
public record RuleOutcome(
        String ruleId,
        String ruleName,
        boolean conditionMet,
        RuleAction action,
        Severity severity,
        int score,
        String message,
        String error
) {
    public static RuleOutcome evaluated(Rule<?> rule, boolean conditionMet) {
        return new RuleOutcome(rule.id(), rule.name(), conditionMet, rule.action(),
                rule.severity(), rule.score(), rule.message(), null);
    }

    public static RuleOutcome failure(Rule<?> rule, Exception cause) {
        return new RuleOutcome(rule.id(), rule.name(), false, rule.action(),
                Severity.HIGH, 0, rule.message(), cause.getMessage());
    }

    public boolean isError() {
        return error != null;
    }
}
