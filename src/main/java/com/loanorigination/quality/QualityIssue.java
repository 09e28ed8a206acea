package com.loanorigination.quality;

/**
 * One finding of a quality check.
 *
 * @param subject   what the issue is about: a document type, a field, a
 *                  regulation or policy name, or a calculation
 * @param checkType the check that raised it; filled in by the aggregator
 */
public record QualityIssue(
        IssueType type,
        IssueSeverity severity,
        String description,
        String subject,
        String checkType
) {
    public static QualityIssue of(IssueType type, IssueSeverity severity, String description, String subject) {
        return new QualityIssue(type, severity, description, subject, null);
    }

    public QualityIssue withCheckType(String checkType) {
        return new QualityIssue(type, severity, description, subject, checkType);
    }

    public boolean isCritical() {
        return severity == IssueSeverity.CRITICAL;
    }
}
