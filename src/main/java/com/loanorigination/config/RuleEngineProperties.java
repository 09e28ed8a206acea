package com.loanorigination.config;

import com.loanorigination.rules.domain.CreditBureauThresholds;
import com.loanorigination.rules.domain.EligibilityThresholds;
import com.loanorigination.rules.domain.KycThresholds;
import com.loanorigination.rules.domain.RiskThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Thresholds of the four domain rule engines, bound from {@code loan.rules.*}.
 *
 * Every value has a default, so an empty configuration yields the standard
 * lending policy.
 */
@ConfigurationProperties(prefix = "loan.rules")
@Validated
@Data
public class RuleEngineProperties {

    @Valid
    private Kyc kyc = new Kyc();

    @Valid
    private CreditBureau creditBureau = new CreditBureau();

    @Valid
    private Eligibility eligibility = new Eligibility();

    @Valid
    private Risk risk = new Risk();

    @Data
    public static class Kyc {
        @Min(18)
        private int minAge = 21;
        @Max(100)
        private int maxAge = 65;

        public KycThresholds toThresholds() {
            return new KycThresholds(minAge, maxAge);
        }
    }

    @Data
    public static class CreditBureau {
        @Min(CreditBureauThresholds.SCORE_FLOOR)
        @Max(CreditBureauThresholds.SCORE_CEILING)
        private int minCibilScore = 650;
        @Min(CreditBureauThresholds.SCORE_FLOOR)
        @Max(CreditBureauThresholds.SCORE_CEILING)
        private int excellentCibilScore = 750;
        @Positive
        private int maxDpdDays = 90;
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private BigDecimal maxUtilizationRatio = new BigDecimal("0.75");
        @Min(0)
        private int maxRecentInquiries = 6;
        @Min(0)
        private int minHistoryMonths = 12;

        public CreditBureauThresholds toThresholds() {
            return new CreditBureauThresholds(minCibilScore, excellentCibilScore, maxDpdDays,
                    maxUtilizationRatio, maxRecentInquiries, minHistoryMonths);
        }
    }

    @Data
    public static class Eligibility {
        @Min(18)
        private int minAge = 21;
        @Max(100)
        private int maxAge = 65;
        @NotNull
        @Positive
        private BigDecimal minLoanAmount = new BigDecimal("25000");
        @NotNull
        @Positive
        private BigDecimal maxLoanAmount = new BigDecimal("2000000");
        @NotNull
        @Positive
        private BigDecimal minIncomeSalaried = new BigDecimal("20000");
        @NotNull
        @Positive
        private BigDecimal minIncomeSelfEmployed = new BigDecimal("25000");
        @NotNull
        @Positive
        private BigDecimal minIncomeProfessional = new BigDecimal("30000");

        public EligibilityThresholds toThresholds() {
            return new EligibilityThresholds(minAge, maxAge, minLoanAmount, maxLoanAmount,
                    minIncomeSalaried, minIncomeSelfEmployed, minIncomeProfessional);
        }
    }

    @Data
    public static class Risk {
        @NotNull
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private BigDecimal maxDtiRatio = new BigDecimal("0.60");
        @NotNull
        @DecimalMin("0.0")
        private BigDecimal maxIncomeVariance = new BigDecimal("0.30");
        @Min(0)
        private int maxBouncesSixMonths = 3;
        @NotNull
        @Positive
        private BigDecimal maxLoanToIncomeMultiple = new BigDecimal("8");

        public RiskThresholds toThresholds() {
            return new RiskThresholds(maxDtiRatio, maxIncomeVariance, maxBouncesSixMonths, maxLoanToIncomeMultiple);
        }
    }
}
