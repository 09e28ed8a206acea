package com.loanorigination.quality.checks;

import com.loanorigination.quality.CreditDecision;
import com.loanorigination.quality.IssueSeverity;
import com.loanorigination.quality.IssueType;
import com.loanorigination.quality.QualityCheck;
import com.loanorigination.quality.QualityCheckContext;
import com.loanorigination.quality.QualityCheckResult;
import com.loanorigination.quality.QualityCheckType;
import com.loanorigination.quality.QualityIssue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fair Practice Code and interest rate disclosure.
 */
@Component
public class RegulatoryComplianceCheck implements QualityCheck {

    @Override
    public QualityCheckType type() {
        return QualityCheckType.REGULATORY_COMPLIANCE;
    }

    @Override
    public QualityCheckResult run(QualityCheckContext context) {
        CreditDecision decision = context.decision();
        List<QualityIssue> issues = new ArrayList<>();
        int score = 100;

        boolean fairPracticeDisclosed = decision.loanConditions().stream()
                .filter(condition -> condition != null)
                .map(condition -> condition.toLowerCase(Locale.ROOT))
                .anyMatch(condition -> condition.contains("fair practice") || condition.contains("grievance"));
        if (!fairPracticeDisclosed) {
            issues.add(QualityIssue.of(IssueType.REGULATORY_GAP, IssueSeverity.WARNING,
                    "Fair Practice Code disclosure missing", "RBI Fair Practice Code"));
            score -= 10;
        }

        if (decision.interestRate() == null || decision.interestRate().signum() <= 0) {
            issues.add(QualityIssue.of(IssueType.REGULATORY_GAP, IssueSeverity.CRITICAL,
                    "Interest rate not properly disclosed", "Interest Rate Disclosure"));
            score -= 20;
        }

        return QualityCheckResult.of(type(), score, issues);
    }
}
