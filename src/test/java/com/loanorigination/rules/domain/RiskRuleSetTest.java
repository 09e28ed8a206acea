package com.loanorigination.rules.domain;

import com.loanorigination.rules.Decision;
import com.loanorigination.rules.ExecutionResult;
import com.loanorigination.rules.RuleEngine;
import com.loanorigination.rules.RuleOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RiskRuleSetTest {

    private final RuleEngine<RiskSnapshot> engine = RiskRuleSet.create(RiskThresholds.defaults());

    private static RiskSnapshot.RiskSnapshotBuilder lowRiskApplicant() {
        return RiskSnapshot.builder()
                .monthlyIncome(new BigDecimal("100000"))
                .existingEmi(new BigDecimal("10000"))
                .proposedEmi(new BigDecimal("15000"))
                .requestedAmount(new BigDecimal("1000000"))
                .incomeVariance(new BigDecimal("0.05"))
                .bouncesLastSixMonths(0)
                .employmentSector("IT")
                .fraudIndicatorCount(0)
                .documentTampering(false);
    }

    @Test
    @DisplayName("Derived ratios: DTI, surplus and loan-to-annual-income")
    void derivesRatios() {
        RiskSnapshot snapshot = lowRiskApplicant().build();

        assertThat(snapshot.dtiRatio()).isEqualByComparingTo("0.25");
        assertThat(snapshot.monthlySurplus()).isEqualByComparingTo("75000");
        assertThat(snapshot.loanToIncomeMultiple()).isEqualByComparingTo(
                new BigDecimal("1000000").divide(new BigDecimal("1200000"), java.math.MathContext.DECIMAL64));
        assertThat(snapshot.fields()).containsKeys("dti_ratio", "monthly_surplus", "loan_to_income_multiple");
    }

    @Test
    @DisplayName("Zero income leaves the ratios undefined instead of dividing by zero")
    void zeroIncomeHasNoRatios() {
        RiskSnapshot snapshot = lowRiskApplicant().monthlyIncome(BigDecimal.ZERO).build();

        assertThat(snapshot.dtiRatio()).isNull();
        assertThat(snapshot.loanToIncomeMultiple()).isNull();
        assertThat(snapshot.fields()).containsEntry("dti_ratio", null);
    }

    @Test
    @DisplayName("Low-risk profile approves and the score stays within 100")
    void lowRiskApproves() {
        ExecutionResult result = engine.executeRules(lowRiskApplicant().build());

        assertThat(result.passed()).extracting(RuleOutcome::ruleId)
                .containsExactly("RISK_001", "RISK_005", "RISK_007", "RISK_010", "RISK_014");
        assertThat(result.score()).isEqualTo(95);
        assertThat(result.decision()).isEqualTo(Decision.APPROVE);
    }

    @Test
    @DisplayName("DTI above the maximum rejects")
    void excessiveDtiRejects() {
        ExecutionResult result = engine.executeRules(lowRiskApplicant()
                .monthlyIncome(new BigDecimal("50000"))
                .existingEmi(new BigDecimal("20000"))
                .proposedEmi(new BigDecimal("15000"))
                .requestedAmount(new BigDecimal("500000"))
                .build());

        assertThat(result.failed()).extracting(RuleOutcome::ruleId).containsExactly("RISK_013");
        assertThat(result.decision()).isEqualTo(Decision.REJECT);
    }

    @Test
    @DisplayName("DTI between 50% and the maximum is a high-severity condition, not a rejection")
    void highDtiIsConditional() {
        ExecutionResult result = engine.executeRules(lowRiskApplicant()
                .existingEmi(new BigDecimal("30000"))
                .proposedEmi(new BigDecimal("25000"))
                .build());

        assertThat(result.flags()).extracting(RuleOutcome::ruleId).containsExactly("RISK_012");
        assertThat(result.failed()).isEmpty();
        assertThat(result.decision()).isEqualTo(Decision.CONDITIONAL);
    }

    @Test
    @DisplayName("Fraud indicators and document tampering reject outright")
    void fraudRejects() {
        ExecutionResult result = engine.executeRules(lowRiskApplicant()
                .fraudIndicatorCount(2)
                .documentTampering(true)
                .build());

        assertThat(result.failed()).extracting(RuleOutcome::ruleId).containsExactly("RISK_017", "RISK_018");
        assertThat(result.decision()).isEqualTo(Decision.REJECT);
        assertThat(result.score()).isZero();
    }

    @Test
    @DisplayName("Bounce bands: tolerated bounces are conditional, frequent bounces reject")
    void bounceBands() {
        assertThat(engine.executeRules(lowRiskApplicant().bouncesLastSixMonths(2).build()).flags())
                .extracting(RuleOutcome::ruleId).containsExactly("RISK_008");
        assertThat(engine.executeRules(lowRiskApplicant().bouncesLastSixMonths(5).build()).failed())
                .extracting(RuleOutcome::ruleId).containsExactly("RISK_009");
    }

    @Test
    @DisplayName("Score is clamped to [0, 100] across very different profiles")
    void scoreAlwaysWithinBounds() {
        List<RiskSnapshot> profiles = List.of(
                lowRiskApplicant().build(),
                lowRiskApplicant().fraudIndicatorCount(3).documentTampering(true)
                        .incomeVariance(new BigDecimal("0.9")).bouncesLastSixMonths(9).build(),
                RiskSnapshot.builder().build(),
                lowRiskApplicant().monthlyIncome(new BigDecimal("1000")).build());

        for (RiskSnapshot profile : profiles) {
            assertThat(engine.executeRules(profile).score()).isBetween(0, 100);
        }
    }

    @Test
    @DisplayName("Thresholds require every ratio and reject non-positive limits")
    void rejectsInvalidThresholds() {
        assertThatThrownBy(() -> new RiskThresholds(null, new BigDecimal("0.30"), 3, new BigDecimal("8")))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("maxDtiRatio");
        assertThatThrownBy(() -> new RiskThresholds(BigDecimal.ZERO, new BigDecimal("0.30"), 3, new BigDecimal("8")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RiskThresholds(new BigDecimal("0.60"), new BigDecimal("0.30"), -1,
                new BigDecimal("8")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBouncesSixMonths");
    }
}
