package com.loanorigination.quality;

import java.time.Instant;
import java.util.List;

/**
 * Immutable result of a quality evaluation.
 */
public record QualityReport(
        String applicationId,
        QualityStatus overallStatus,
        int complianceScore,
        int accuracyScore,
        List<QualityCheckResult> checks,
        List<QualityIssue> issuesFound,
        List<Recommendation> recommendations,
        boolean manualReviewRequired,
        Instant checkedAt
) {
    public QualityReport {
        checks = List.copyOf(checks);
        issuesFound = List.copyOf(issuesFound);
        recommendations = List.copyOf(recommendations);
    }

    public long countByStatus(QualityStatus status) {
        return checks.stream().filter(check -> check.status() == status).count();
    }

    public long criticalIssueCount() {
        return issuesFound.stream().filter(QualityIssue::isCritical).count();
    }
}
