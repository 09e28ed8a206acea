package com.loanorigination.rules.domain;

import com.loanorigination.rules.RuleSnapshot;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;

/**
 * Banking and obligation facts for risk scoring. Debt-to-income, surplus and
 * loan-to-income are derived from the monthly figures and are {@code null}
 * when income is unknown or zero.
 */
@Builder
public record RiskSnapshot(
        BigDecimal monthlyIncome,
        BigDecimal existingEmi,
        BigDecimal proposedEmi,
        BigDecimal requestedAmount,
        BigDecimal incomeVariance,
        Integer bouncesLastSixMonths,
        String employmentSector,
        Integer fraudIndicatorCount,
        Boolean documentTampering
) implements RuleSnapshot {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    public BigDecimal totalObligations() {
        return orZero(existingEmi).add(orZero(proposedEmi));
    }

    public BigDecimal dtiRatio() {
        if (!hasIncome()) {
            return null;
        }
        return totalObligations().divide(monthlyIncome, MathContext.DECIMAL64);
    }

    public BigDecimal monthlySurplus() {
        if (monthlyIncome == null) {
            return null;
        }
        return monthlyIncome.subtract(totalObligations());
    }

    /**
     * Requested amount as a multiple of annual income.
     */
    public BigDecimal loanToIncomeMultiple() {
        if (!hasIncome() || requestedAmount == null) {
            return null;
        }
        return requestedAmount.divide(monthlyIncome.multiply(MONTHS_PER_YEAR), MathContext.DECIMAL64);
    }

    private boolean hasIncome() {
        return monthlyIncome != null && monthlyIncome.signum() > 0;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    @Override
    public Map<String, Object> fields() {
        return SnapshotFields.builder()
                .put("monthly_income", monthlyIncome)
                .put("existing_emi", existingEmi)
                .put("proposed_emi", proposedEmi)
                .put("requested_amount", requestedAmount)
                .put("income_variance", incomeVariance)
                .put("bounces_last_6_months", bouncesLastSixMonths)
                .put("employment_sector", employmentSector)
                .put("fraud_indicator_count", fraudIndicatorCount)
                .put("document_tampering", documentTampering)
                .put("dti_ratio", dtiRatio())
                .put("monthly_surplus", monthlySurplus())
                .put("loan_to_income_multiple", loanToIncomeMultiple())
                .build();
    }
}
