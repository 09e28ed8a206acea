package com.loanorigination.rules.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Ratios are fractions (0.60 means 60%).
 */
public record RiskThresholds(
        BigDecimal maxDtiRatio,
        BigDecimal maxIncomeVariance,
        int maxBouncesSixMonths,
        BigDecimal maxLoanToIncomeMultiple
) {

    public RiskThresholds {
        Objects.requireNonNull(maxDtiRatio, "maxDtiRatio");
        Objects.requireNonNull(maxIncomeVariance, "maxIncomeVariance");
        Objects.requireNonNull(maxLoanToIncomeMultiple, "maxLoanToIncomeMultiple");
        if (maxDtiRatio.signum() <= 0 || maxIncomeVariance.signum() < 0 || maxLoanToIncomeMultiple.signum() <= 0) {
            throw new IllegalArgumentException("Risk ratios must be positive");
        }
        if (maxBouncesSixMonths < 0) {
            throw new IllegalArgumentException("maxBouncesSixMonths must not be negative");
        }
    }

    public static RiskThresholds defaults() {
        return new RiskThresholds(new BigDecimal("0.60"), new BigDecimal("0.30"), 3, new BigDecimal("8"));
    }
}
