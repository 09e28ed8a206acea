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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Recomputes the EMI from the approved amount, tenure and rate.
 */
@Component
public class CalculationVerificationCheck implements QualityCheck {

    static final BigDecimal EMI_TOLERANCE = BigDecimal.TEN;
    static final int MISMATCH_PENALTY = 25;

    private static final BigDecimal MONTHLY_PERCENT_DIVISOR = BigDecimal.valueOf(1200);

    @Override
    public QualityCheckType type() {
        return QualityCheckType.CALCULATION_VERIFICATION;
    }

    @Override
    public QualityCheckResult run(QualityCheckContext context) {
        CreditDecision decision = context.decision();
        BigDecimal expected = calculateEmi(decision.approvedLoanAmount(), decision.approvedTenure(),
                decision.interestRate());

        if (expected == null || decision.monthlyEmi() == null) {
            QualityIssue issue = QualityIssue.of(IssueType.CALCULATION_ERROR, IssueSeverity.CRITICAL,
                    "EMI could not be verified: amount, tenure, rate or EMI missing", "EMI");
            return QualityCheckResult.of(type(), 100 - MISMATCH_PENALTY, List.of(issue));
        }

        BigDecimal difference = expected.subtract(decision.monthlyEmi()).abs();
        if (difference.compareTo(EMI_TOLERANCE) > 0) {
            QualityIssue issue = QualityIssue.of(IssueType.CALCULATION_ERROR, IssueSeverity.CRITICAL,
                    "EMI calculation mismatch: expected " + expected.toPlainString()
                            + ", got " + decision.monthlyEmi().toPlainString(), "EMI");
            return QualityCheckResult.of(type(), 100 - MISMATCH_PENALTY, List.of(issue));
        }
        return QualityCheckResult.of(type(), 100, List.of());
    }

    /**
     * Reducing-balance EMI rounded to whole rupees, or {@code null} when an
     * input is missing or not positive.
     *
     * @param annualRatePercent annual interest rate in percent
     */
    public static BigDecimal calculateEmi(BigDecimal principal, Integer tenureMonths, BigDecimal annualRatePercent) {
        if (principal == null || tenureMonths == null || annualRatePercent == null
                || principal.signum() <= 0 || tenureMonths <= 0 || annualRatePercent.signum() < 0) {
            return null;
        }
        if (annualRatePercent.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(tenureMonths), 0, RoundingMode.HALF_UP);
        }
        MathContext mc = MathContext.DECIMAL64;
        BigDecimal monthlyRate = annualRatePercent.divide(MONTHLY_PERCENT_DIVISOR, mc);
        BigDecimal growth = BigDecimal.ONE.add(monthlyRate).pow(tenureMonths, mc);
        BigDecimal emi = principal.multiply(monthlyRate, mc).multiply(growth, mc)
                .divide(growth.subtract(BigDecimal.ONE), mc);
        return emi.setScale(0, RoundingMode.HALF_UP);
    }
}
