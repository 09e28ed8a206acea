package com.loanorigination.quality.checks;

import com.loanorigination.quality.CreditDecision;
import com.loanorigination.quality.CreditDecision.FinalDecision;
import com.loanorigination.quality.CreditDecision.RiskCategory;
import com.loanorigination.quality.IssueSeverity;
import com.loanorigination.quality.IssueType;
import com.loanorigination.quality.QualityCheck;
import com.loanorigination.quality.QualityCheckContext;
import com.loanorigination.quality.QualityCheckResult;
import com.loanorigination.quality.QualityCheckType;
import com.loanorigination.quality.QualityIssue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags approvals that look generous for the risk profile. Any concern
 * sends the application to manual review.
 */
@Component
public class RiskValidationCheck implements QualityCheck {

    private static final BigDecimal LARGE_LOAN = new BigDecimal("1000000");
    private static final int LOW_CREDIT_SCORE = 650;
    private static final BigDecimal HIGH_DTI = new BigDecimal("0.50");

    @Override
    public QualityCheckType type() {
        return QualityCheckType.RISK_VALIDATION;
    }

    @Override
    public QualityCheckResult run(QualityCheckContext context) {
        CreditDecision decision = context.decision();
        boolean unconditional = decision.finalDecision() == FinalDecision.APPROVED;
        List<QualityIssue> issues = new ArrayList<>();
        int score = 100;

        if (decision.riskCategory() == RiskCategory.HIGH && decision.approvedLoanAmount() != null
                && decision.approvedLoanAmount().compareTo(LARGE_LOAN) > 0) {
            issues.add(concern("High risk applicant approved for large loan amount", "High Risk + Large Amount"));
            score -= 15;
        }
        if (unconditional && decision.creditScore() != null && decision.creditScore() < LOW_CREDIT_SCORE) {
            issues.add(concern("Low credit score applicant approved without conditions", "Low Credit Score"));
            score -= 10;
        }
        if (unconditional && decision.dtiRatio() != null && decision.dtiRatio().compareTo(HIGH_DTI) > 0) {
            issues.add(concern("High DTI ratio applicant approved", "High DTI Ratio"));
            score -= 10;
        }

        return QualityCheckResult.of(type(), score, issues, !issues.isEmpty());
    }

    private static QualityIssue concern(String description, String factor) {
        return QualityIssue.of(IssueType.RISK_CONCERN, IssueSeverity.WARNING, description, factor);
    }
}
