package com.loanorigination.event;

import com.loanorigination.quality.QualityStatus;

import java.time.Instant;

public record QualityCheckCompleted(
    String eventId,
    String applicationId,
    QualityStatus overallStatus,
    int complianceScore,
    int accuracyScore,
    long criticalIssues,
    boolean manualReviewRequired,
    Instant checkedAt
) {
    public QualityCheckCompleted {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("Application ID cannot be null or empty");
        }
        if (overallStatus == null) {
            throw new IllegalArgumentException("Overall status cannot be null");
        }
        if (checkedAt == null) {
            checkedAt = Instant.now();
        }
    }
}
