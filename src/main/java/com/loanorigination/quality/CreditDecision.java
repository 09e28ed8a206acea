package com.loanorigination.quality;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Terms produced by the credit decision stage.
 *
 * @param interestRate annual rate in percent
 * @param dtiRatio     debt-to-income as a fraction
 */
@Builder
public record CreditDecision(
        FinalDecision finalDecision,
        BigDecimal approvedLoanAmount,
        Integer approvedTenure,
        BigDecimal interestRate,
        BigDecimal monthlyEmi,
        Integer creditScore,
        BigDecimal dtiRatio,
        RiskCategory riskCategory,
        List<String> loanConditions
) {
    public CreditDecision {
        loanConditions = loanConditions == null ? List.of() : List.copyOf(loanConditions);
    }

    public enum FinalDecision {
        APPROVED,
        CONDITIONAL_APPROVAL,
        REJECTED,
        REFERRED
    }

    public enum RiskCategory {
        LOW,
        MEDIUM,
        HIGH
    }

    public boolean isApproved() {
        return finalDecision == FinalDecision.APPROVED || finalDecision == FinalDecision.CONDITIONAL_APPROVAL;
    }
}
