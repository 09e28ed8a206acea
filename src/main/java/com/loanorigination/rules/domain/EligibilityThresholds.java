package com.loanorigination.rules.domain;

import java.math.BigDecimal;
import java.util.Objects;

public record EligibilityThresholds(
        int minAge,
        int maxAge,
        BigDecimal minLoanAmount,
        BigDecimal maxLoanAmount,
        BigDecimal minIncomeSalaried,
        BigDecimal minIncomeSelfEmployed,
        BigDecimal minIncomeProfessional
) {

    public EligibilityThresholds {
        Objects.requireNonNull(minLoanAmount, "minLoanAmount");
        Objects.requireNonNull(maxLoanAmount, "maxLoanAmount");
        Objects.requireNonNull(minIncomeSalaried, "minIncomeSalaried");
        Objects.requireNonNull(minIncomeSelfEmployed, "minIncomeSelfEmployed");
        Objects.requireNonNull(minIncomeProfessional, "minIncomeProfessional");
        if (minAge > maxAge) {
            throw new IllegalArgumentException("minAge must not exceed maxAge");
        }
        if (minLoanAmount.compareTo(maxLoanAmount) > 0) {
            throw new IllegalArgumentException("minLoanAmount must not exceed maxLoanAmount");
        }
    }

    public static EligibilityThresholds defaults() {
        return new EligibilityThresholds(21, 65,
                new BigDecimal("25000"), new BigDecimal("2000000"),
                new BigDecimal("20000"), new BigDecimal("25000"), new BigDecimal("30000"));
    }

    /**
     * Minimum monthly income for the employment class. Unknown classes use
     * the strictest floor.
     */
    public BigDecimal minimumIncomeFor(EmploymentType type) {
        if (type == null) {
            return minIncomeProfessional.max(minIncomeSelfEmployed).max(minIncomeSalaried);
        }
        return switch (type) {
            case SALARIED -> minIncomeSalaried;
            case SELF_EMPLOYED -> minIncomeSelfEmployed;
            case PROFESSIONAL -> minIncomeProfessional;
            case OTHER -> minIncomeProfessional.max(minIncomeSelfEmployed).max(minIncomeSalaried);
        };
    }
}
