package com.loanorigination.quality;

public record Recommendation(
        Type type,
        Priority priority,
        String description,
        String actionRequired
) {
    public enum Type {
        DOCUMENT_COLLECTION,
        COMPLIANCE_REVIEW,
        CALCULATION_REVIEW,
        GENERAL_REVIEW
    }

    public enum Priority {
        HIGH,
        MEDIUM
    }

    static Recommendation forIssue(QualityIssue issue) {
        Priority bySeverity = issue.isCritical() ? Priority.HIGH : Priority.MEDIUM;
        return switch (issue.type()) {
            case MISSING_DOCUMENT -> new Recommendation(Type.DOCUMENT_COLLECTION, bySeverity,
                    "Collect missing document: " + issue.subject(), "Document collection");
            case COMPLIANCE_VIOLATION -> new Recommendation(Type.COMPLIANCE_REVIEW, Priority.HIGH,
                    "Review compliance violation: " + issue.description(), "Manual review");
            case CALCULATION_ERROR -> new Recommendation(Type.CALCULATION_REVIEW, Priority.HIGH,
                    "Verify and correct calculation: " + issue.subject(), "Calculation correction");
            default -> new Recommendation(Type.GENERAL_REVIEW, bySeverity,
                    "Address issue: " + issue.description(), "Review and resolution");
        };
    }
}
