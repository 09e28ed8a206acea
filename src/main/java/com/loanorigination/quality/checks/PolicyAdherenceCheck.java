package com.loanorigination.quality.checks;

import com.loanorigination.quality.CreditDecision;
import com.loanorigination.quality.IssueSeverity;
import com.loanorigination.quality.IssueType;
import com.loanorigination.quality.LoanProductPolicy;
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
 * Approved terms against the product policy: amount as a multiple of
 * income, rate range and tenure ceiling.
 */
@Component
public class PolicyAdherenceCheck implements QualityCheck {

    static final int AMOUNT_PENALTY = 30;
    static final int RATE_PENALTY = 15;
    static final int TENURE_PENALTY = 15;

    @Override
    public QualityCheckType type() {
        return QualityCheckType.POLICY_ADHERENCE;
    }

    @Override
    public QualityCheckResult run(QualityCheckContext context) {
        CreditDecision decision = context.decision();
        LoanProductPolicy policy = context.policy();
        BigDecimal monthlyIncome = context.application().monthlyIncome();
        List<QualityIssue> issues = new ArrayList<>();
        int score = 100;

        if (monthlyIncome != null && decision.approvedLoanAmount() != null) {
            BigDecimal limit = policy.maxLoanAmount(monthlyIncome);
            if (decision.approvedLoanAmount().compareTo(limit) > 0) {
                issues.add(QualityIssue.of(IssueType.POLICY_VIOLATION, IssueSeverity.CRITICAL,
                        "Approved amount " + decision.approvedLoanAmount().toPlainString()
                                + " exceeds policy limit " + limit.toPlainString(),
                        "Loan Amount Policy"));
                score -= AMOUNT_PENALTY;
            }
        }

        if (decision.interestRate() != null && !policy.isRateWithinRange(decision.interestRate())) {
            issues.add(QualityIssue.of(IssueType.POLICY_VIOLATION, IssueSeverity.WARNING,
                    "Interest rate " + decision.interestRate().toPlainString() + "% outside policy range "
                            + policy.getMinInterestRate() + "%-" + policy.getMaxInterestRate() + "%",
                    "Interest Rate Policy"));
            score -= RATE_PENALTY;
        }

        if (decision.approvedTenure() != null && decision.approvedTenure() > policy.getMaxTenureMonths()) {
            issues.add(QualityIssue.of(IssueType.POLICY_VIOLATION, IssueSeverity.WARNING,
                    "Approved tenure " + decision.approvedTenure() + " months exceeds policy limit "
                            + policy.getMaxTenureMonths() + " months",
                    "Tenure Policy"));
            score -= TENURE_PENALTY;
        }

        return QualityCheckResult.of(type(), score, issues);
    }
}
