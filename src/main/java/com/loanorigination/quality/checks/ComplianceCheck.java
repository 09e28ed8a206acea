package com.loanorigination.quality.checks;

import com.loanorigination.quality.CreditDecision;
import com.loanorigination.quality.IssueSeverity;
import com.loanorigination.quality.IssueType;
import com.loanorigination.quality.LoanApplicationSnapshot;
import com.loanorigination.quality.LoanProductPolicy;
import com.loanorigination.quality.QualityCheck;
import com.loanorigination.quality.QualityCheckContext;
import com.loanorigination.quality.QualityCheckResult;
import com.loanorigination.quality.QualityCheckType;
import com.loanorigination.quality.QualityIssue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Age, income, credit score, debt-to-income and KYC compliance.
 */
@Component
public class ComplianceCheck implements QualityCheck {

    static final int MIN_AGE = 21;
    static final int MAX_AGE = 65;
    static final BigDecimal MAX_DTI_RATIO = new BigDecimal("0.60");

    private static final int VIOLATION_PENALTY = 25;
    private static final int PAN_PENALTY = 20;
    private static final Pattern PAN = Pattern.compile("^[A-Z]{5}[0-9]{4}[A-Z]$");

    @Override
    public QualityCheckType type() {
        return QualityCheckType.COMPLIANCE_CHECK;
    }

    @Override
    public QualityCheckResult run(QualityCheckContext context) {
        LoanApplicationSnapshot app = context.application();
        CreditDecision decision = context.decision();
        LoanProductPolicy policy = context.policy();
        List<QualityIssue> issues = new ArrayList<>();
        int score = 100;

        if (app.dateOfBirth() == null) {
            issues.add(violation("Date of birth missing, age cannot be established", "Age Eligibility Policy"));
            score -= VIOLATION_PENALTY;
        } else {
            int age = Period.between(app.dateOfBirth(), context.today()).getYears();
            if (age < MIN_AGE || age > MAX_AGE) {
                issues.add(violation("Applicant age " + age + " outside acceptable range (" + MIN_AGE + "-" + MAX_AGE + ")",
                        "Age Eligibility Policy"));
                score -= VIOLATION_PENALTY;
            }
        }

        if (app.monthlyIncome() == null || app.monthlyIncome().compareTo(policy.getMinMonthlyIncome()) < 0) {
            issues.add(violation("Monthly income below minimum requirement of "
                    + policy.getMinMonthlyIncome().toPlainString(), "Minimum Income Policy"));
            score -= VIOLATION_PENALTY;
        }

        int creditScore = decision.creditScore() == null ? 0 : decision.creditScore();
        if (creditScore < policy.getMinCreditScore()) {
            issues.add(violation("Credit score " + creditScore + " below minimum requirement of "
                    + policy.getMinCreditScore(), "Credit Score Policy"));
            score -= VIOLATION_PENALTY;
        }

        if (decision.dtiRatio() != null && decision.dtiRatio().compareTo(MAX_DTI_RATIO) > 0) {
            issues.add(violation("DTI ratio " + decision.dtiRatio().toPlainString() + " exceeds maximum "
                    + MAX_DTI_RATIO.toPlainString(), "Debt-to-Income Policy"));
            score -= VIOLATION_PENALTY;
        }

        if (app.panNumber() == null || !PAN.matcher(app.panNumber()).matches()) {
            issues.add(violation("Invalid or missing PAN number", "KYC Requirements"));
            score -= PAN_PENALTY;
        }

        return QualityCheckResult.of(type(), score, issues);
    }

    private static QualityIssue violation(String description, String regulation) {
        return QualityIssue.of(IssueType.COMPLIANCE_VIOLATION, IssueSeverity.CRITICAL, description, regulation);
    }
}
