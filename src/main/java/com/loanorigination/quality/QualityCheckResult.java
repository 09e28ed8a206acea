package com.loanorigination.quality;

import java.util.List;

/**
 * Outcome of one check. {@code checkType} is a string so caller-requested
 * extra checks sit alongside the standard ones.
 */
public record QualityCheckResult(
        String checkType,
        QualityStatus status,
        int score,
        List<QualityIssue> issues,
        boolean manualReviewRequired
) {
    public QualityCheckResult {
        issues = List.copyOf(issues);
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Score must be within [0, 100]: " + score);
        }
    }

    /**
     * Scores from a penalty-reduced total. Negative totals floor at zero and
     * review is required whenever a critical issue was raised.
     */
    public static QualityCheckResult of(QualityCheckType type, int rawScore, List<QualityIssue> issues) {
        return of(type, rawScore, issues, issues.stream().anyMatch(QualityIssue::isCritical));
    }

    public static QualityCheckResult of(QualityCheckType type, int rawScore, List<QualityIssue> issues,
                                        boolean manualReviewRequired) {
        int score = Math.max(0, Math.min(100, rawScore));
        return new QualityCheckResult(type.getValue(), type.statusFor(score), score, issues, manualReviewRequired);
    }

    public static QualityCheckResult extra(String checkType) {
        return new QualityCheckResult(checkType, QualityStatus.PASSED, 100, List.of(), false);
    }
}
