package com.loanorigination.rules.domain;

import com.loanorigination.rules.Decision;
import com.loanorigination.rules.ExecutionResult;
import com.loanorigination.rules.RuleAction;
import com.loanorigination.rules.RuleEngine;
import com.loanorigination.rules.RuleOutcome;
import com.loanorigination.rules.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EligibilityRuleSetTest {

    private RuleEngine<EligibilitySnapshot> engine;

    @BeforeEach
    void setUp() {
        engine = EligibilityRuleSet.create(EligibilityThresholds.defaults());
    }

    private static EligibilitySnapshot.EligibilitySnapshotBuilder eligibleApplicant() {
        return EligibilitySnapshot.builder()
                .age(32)
                .loanType("personal_loan")
                .employmentType(EmploymentType.SALARIED)
                .monthlyIncome(new BigDecimal("50000"))
                .currentEmploymentMonths(36)
                .requestedAmount(new BigDecimal("500000"))
                .loanPurpose("home_renovation")
                .serviceableArea(true);
    }

    @Test
    @DisplayName("Applicant aged 19 fires a critical reject and the decision is REJECT")
    void underageApplicantRejected() {
        // Given
        EligibilitySnapshot snapshot = EligibilitySnapshot.builder().age(19).build();

        // When
        ExecutionResult result = engine.executeRules(snapshot);

        // Then
        assertThat(result.failed()).anySatisfy(outcome -> {
            assertThat(outcome.ruleId()).isEqualTo("ELIG_001");
            assertThat(outcome.action()).isEqualTo(RuleAction.REJECT);
            assertThat(outcome.severity()).isEqualTo(Severity.CRITICAL);
        });
        assertThat(result.decision()).isEqualTo(Decision.REJECT);
    }

    @Test
    @DisplayName("A fully eligible salaried applicant is approved")
    void eligibleApplicantApproved() {
        ExecutionResult result = engine.executeRules(eligibleApplicant().build());

        assertThat(result.passed()).extracting(RuleOutcome::ruleId)
                .containsExactly("ELIG_003", "ELIG_005", "ELIG_007", "ELIG_010");
        assertThat(result.failed()).isEmpty();
        assertThat(result.score()).isEqualTo(55);
        assertThat(result.decision()).isEqualTo(Decision.APPROVE);
    }

    @Test
    @DisplayName("Income floor depends on the employment type")
    void incomeFloorPerEmploymentType() {
        EligibilitySnapshot salaried = eligibleApplicant().monthlyIncome(new BigDecimal("22000")).build();
        EligibilitySnapshot selfEmployed = eligibleApplicant()
                .employmentType(EmploymentType.SELF_EMPLOYED)
                .monthlyIncome(new BigDecimal("22000"))
                .build();

        assertThat(engine.executeRules(salaried).decision()).isEqualTo(Decision.APPROVE);
        assertThat(engine.executeRules(selfEmployed).failed())
                .extracting(RuleOutcome::ruleId).containsExactly("ELIG_004");
    }

    @Test
    @DisplayName("Short tenure makes the application conditional")
    void shortTenureIsConditional() {
        ExecutionResult result = engine.executeRules(eligibleApplicant().currentEmploymentMonths(3).build());

        assertThat(result.flags()).extracting(RuleOutcome::ruleId).containsExactly("ELIG_006");
        assertThat(result.decision()).isEqualTo(Decision.CONDITIONAL);
    }

    @Test
    @DisplayName("Prohibited purposes and non-serviceable locations reject")
    void purposeAndLocationRejections() {
        ExecutionResult gambling = engine.executeRules(eligibleApplicant().loanPurpose("gambling").build());
        assertThat(gambling.failed()).extracting(RuleOutcome::ruleId).containsExactly("ELIG_011");
        assertThat(gambling.decision()).isEqualTo(Decision.REJECT);

        ExecutionResult remote = engine.executeRules(eligibleApplicant().serviceableArea(false).build());
        assertThat(remote.failed()).extracting(RuleOutcome::ruleId).containsExactly("ELIG_013");
    }

    @Test
    @DisplayName("A missing purpose is only a warning")
    void missingPurposeIsWarning() {
        ExecutionResult result = engine.executeRules(eligibleApplicant().loanPurpose(null).build());

        assertThat(result.warnings()).extracting(RuleOutcome::ruleId).containsExactly("ELIG_012");
        assertThat(result.decision()).isEqualTo(Decision.APPROVE);
    }

    @Test
    @DisplayName("Amount limits reject outside the product range")
    void amountLimits() {
        assertThat(engine.executeRules(eligibleApplicant().requestedAmount(new BigDecimal("10000")).build())
                .failed()).extracting(RuleOutcome::ruleId).containsExactly("ELIG_008");
        assertThat(engine.executeRules(eligibleApplicant().requestedAmount(new BigDecimal("2500000")).build())
                .failed()).extracting(RuleOutcome::ruleId).containsExactly("ELIG_009");
    }

    @Test
    @DisplayName("Thresholds with inverted age or amount ranges are rejected")
    void rejectsInvertedRanges() {
        BigDecimal income = new BigDecimal("20000");

        assertThatThrownBy(() -> new EligibilityThresholds(65, 21,
                new BigDecimal("25000"), new BigDecimal("2000000"), income, income, income))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minAge");
        assertThatThrownBy(() -> new EligibilityThresholds(21, 65,
                new BigDecimal("2000000"), new BigDecimal("25000"), income, income, income))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minLoanAmount");
        assertThatThrownBy(() -> new EligibilityThresholds(21, 65,
                new BigDecimal("25000"), new BigDecimal("2000000"), income, null, income))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("minIncomeSelfEmployed");
    }
}
