package com.loanorigination.rules;

public record ExecutionSummary(
        String engine,
        int totalRules,
        int passed,
        int failed,
        int warnings,
        int flags,
        int score,
        Decision decision
) {
}
