package com.loanorigination.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Output of one {@link RuleEngine#executeRules} call. Buckets keep rule
 * registration order; {@code score} is clamped to [0, 100].
 */
public record ExecutionResult(
        List<RuleOutcome> passed,
        List<RuleOutcome> failed,
        List<RuleOutcome> warnings,
        List<RuleOutcome> flags,
        int score,
        Decision decision
) {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public ExecutionResult {
        passed = List.copyOf(passed);
        failed = List.copyOf(failed);
        warnings = List.copyOf(warnings);
        flags = List.copyOf(flags);
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException("Score must be within [0, 100]: " + score);
        }
    }

    public static ExecutionResult empty() {
        return new ExecutionResult(List.of(), List.of(), List.of(), List.of(), 0, Decision.PENDING);
    }

    /**
     * All recorded outcomes, bucket by bucket.
     */
    public List<RuleOutcome> outcomes() {
        return Stream.of(passed, failed, warnings, flags)
                .flatMap(List::stream)
                .toList();
    }

    public List<String> firedRuleIds() {
        List<String> ids = new ArrayList<>();
        outcomes().forEach(outcome -> ids.add(outcome.ruleId()));
        return ids;
    }

    public boolean hasBlockingFailure() {
        return failed.stream().anyMatch(outcome -> outcome.severity().isBlocking());
    }
}
