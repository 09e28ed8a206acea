package com.loanorigination.quality.checks;

import com.loanorigination.quality.IssueSeverity;
import com.loanorigination.quality.IssueType;
import com.loanorigination.quality.LoanApplicationSnapshot;
import com.loanorigination.quality.QualityCheck;
import com.loanorigination.quality.QualityCheckContext;
import com.loanorigination.quality.QualityCheckResult;
import com.loanorigination.quality.QualityCheckType;
import com.loanorigination.quality.QualityIssue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field-level validation of applicant, financial and loan details.
 */
@Component
public class DataAccuracyCheck implements QualityCheck {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern MOBILE = Pattern.compile("^[6-9]\\d{9}$");
    private static final BigDecimal MAX_LOAN_AMOUNT = new BigDecimal("50000000");
    private static final int MAX_TENURE_MONTHS = 360;

    @Override
    public QualityCheckType type() {
        return QualityCheckType.DATA_ACCURACY;
    }

    @Override
    public QualityCheckResult run(QualityCheckContext context) {
        LoanApplicationSnapshot app = context.application();
        List<QualityIssue> issues = new ArrayList<>();
        int score = 100;

        if (app.fullName() == null || app.fullName().trim().length() < 2) {
            issues.add(invalid(IssueSeverity.CRITICAL, "Invalid or missing applicant name", "full_name"));
            score -= 15;
        }
        if (app.email() == null || !EMAIL.matcher(app.email()).matches()) {
            issues.add(invalid(IssueSeverity.WARNING, "Invalid email format", "email"));
            score -= 5;
        }
        if (app.mobile() == null || !MOBILE.matcher(app.mobile()).matches()) {
            issues.add(invalid(IssueSeverity.CRITICAL, "Invalid mobile number format", "mobile"));
            score -= 15;
        }
        if (app.monthlyIncome() == null || app.monthlyIncome().signum() <= 0) {
            issues.add(invalid(IssueSeverity.CRITICAL, "Invalid monthly income", "monthly_income"));
            score -= 20;
        }
        if (app.existingEmi() != null && app.existingEmi().signum() < 0) {
            issues.add(invalid(IssueSeverity.WARNING, "Negative existing EMI value", "existing_emi"));
            score -= 5;
        }
        if (app.loanAmount() == null || app.loanAmount().signum() <= 0
                || app.loanAmount().compareTo(MAX_LOAN_AMOUNT) > 0) {
            issues.add(invalid(IssueSeverity.CRITICAL, "Invalid loan amount", "loan_amount"));
            score -= 20;
        }
        if (app.tenureMonths() == null || app.tenureMonths() <= 0 || app.tenureMonths() > MAX_TENURE_MONTHS) {
            issues.add(invalid(IssueSeverity.CRITICAL, "Invalid loan tenure", "tenure_months"));
            score -= 15;
        }

        return QualityCheckResult.of(type(), score, issues);
    }

    private static QualityIssue invalid(IssueSeverity severity, String description, String field) {
        return QualityIssue.of(IssueType.INVALID_DATA, severity, description, field);
    }
}
