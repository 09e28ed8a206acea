package com.loanorigination.rules.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Credit bureau cut-offs. Scores are on the 300-900 scale.
 */
public record CreditBureauThresholds(
        int minCibilScore,
        int excellentCibilScore,
        int maxDpdDays,
        BigDecimal maxUtilizationRatio,
        int maxRecentInquiries,
        int minHistoryMonths
) {
    public static final int SCORE_FLOOR = 300;
    public static final int SCORE_CEILING = 900;

    public CreditBureauThresholds {
        Objects.requireNonNull(maxUtilizationRatio, "maxUtilizationRatio");
        if (minCibilScore > excellentCibilScore) {
            throw new IllegalArgumentException("minCibilScore must not exceed excellentCibilScore");
        }
    }

    public static CreditBureauThresholds defaults() {
        return new CreditBureauThresholds(650, 750, 90, new BigDecimal("0.75"), 6, 12);
    }
}
