package com.loanorigination.quality.checks;

import com.loanorigination.quality.IssueSeverity;
import com.loanorigination.quality.IssueType;
import com.loanorigination.quality.LoanProductPolicy.RequiredDocument;
import com.loanorigination.quality.QualityCheck;
import com.loanorigination.quality.QualityCheckContext;
import com.loanorigination.quality.QualityCheckResult;
import com.loanorigination.quality.QualityCheckType;
import com.loanorigination.quality.QualityIssue;
import com.loanorigination.quality.SubmittedDocument;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Required documents present, complete and recent enough.
 */
@Component
public class DocumentVerificationCheck implements QualityCheck {

    static final int MISSING_MANDATORY_PENALTY = 20;
    static final int MISSING_OPTIONAL_PENALTY = 10;
    static final int INCOMPLETE_PENALTY = 5;
    static final int OUTDATED_PENALTY = 5;

    // Maximum document age in days
    private static final Map<String, Integer> MAX_AGE_DAYS = Map.of(
            "bank_statement", 90,
            "income_proof", 180,
            "identity_proof", 365,
            "address_proof", 365);
    private static final int DEFAULT_MAX_AGE_DAYS = 180;

    @Override
    public QualityCheckType type() {
        return QualityCheckType.DOCUMENT_VERIFICATION;
    }

    @Override
    public QualityCheckResult run(QualityCheckContext context) {
        List<QualityIssue> issues = new ArrayList<>();
        int score = 100;
        List<SubmittedDocument> provided = context.application().documents();

        for (RequiredDocument required : context.policy().getRequiredDocuments()) {
            boolean present = provided.stream().anyMatch(doc -> required.type().equals(doc.documentType()));
            if (!present) {
                issues.add(QualityIssue.of(IssueType.MISSING_DOCUMENT,
                        required.mandatory() ? IssueSeverity.CRITICAL : IssueSeverity.WARNING,
                        "Missing required document: " + required.name(), required.type()));
                score -= required.mandatory() ? MISSING_MANDATORY_PENALTY : MISSING_OPTIONAL_PENALTY;
            }
        }

        for (SubmittedDocument doc : provided) {
            if (doc.filePath() == null || doc.filePath().isBlank() || doc.uploadDate() == null) {
                issues.add(QualityIssue.of(IssueType.INCOMPLETE_DOCUMENT, IssueSeverity.WARNING,
                        "Incomplete document information: " + doc.documentType(), doc.documentType()));
                score -= INCOMPLETE_PENALTY;
            }
            if (doc.uploadDate() != null && isTooOld(doc, context.today())) {
                issues.add(QualityIssue.of(IssueType.OUTDATED_DOCUMENT, IssueSeverity.WARNING,
                        "Document may be outdated: " + doc.documentType(), doc.documentType()));
                score -= OUTDATED_PENALTY;
            }
        }

        return QualityCheckResult.of(type(), score, issues);
    }

    private static boolean isTooOld(SubmittedDocument doc, LocalDate today) {
        long ageDays = ChronoUnit.DAYS.between(doc.uploadDate(), today);
        return ageDays > MAX_AGE_DAYS.getOrDefault(doc.documentType(), DEFAULT_MAX_AGE_DAYS);
    }
}
