package com.loanorigination.quality;

import com.loanorigination.exception.QualityCheckNotApplicableException;
import com.loanorigination.quality.checks.CalculationVerificationCheck;
import com.loanorigination.quality.checks.ComplianceCheck;
import com.loanorigination.quality.checks.DataAccuracyCheck;
import com.loanorigination.quality.checks.DocumentVerificationCheck;
import com.loanorigination.quality.checks.PolicyAdherenceCheck;
import com.loanorigination.quality.checks.RegulatoryComplianceCheck;
import com.loanorigination.quality.checks.RiskValidationCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.loanorigination.quality.QualityFixtures.cleanApplication;
import static com.loanorigination.quality.QualityFixtures.cleanApproval;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityAggregatorTest {

    private QualityAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new QualityAggregator(List.of(
                new RegulatoryComplianceCheck(),
                new DocumentVerificationCheck(),
                new DataAccuracyCheck(),
                new ComplianceCheck(),
                new PolicyAdherenceCheck(),
                new RiskValidationCheck(),
                new CalculationVerificationCheck()), QualityFixtures.CLOCK);
    }

    private static QualityCheckResult check(QualityReport report, QualityCheckType type) {
        return report.checks().stream()
                .filter(result -> result.checkType().equals(type.getValue()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("A clean approval passes every check with full composite scores")
    void cleanApprovalPasses() {
        QualityReport report = aggregator.evaluate(cleanApplication().build(), cleanApproval().build(), null);

        assertThat(report.overallStatus()).isEqualTo(QualityStatus.PASSED);
        assertThat(report.complianceScore()).isEqualTo(100);
        assertThat(report.accuracyScore()).isEqualTo(100);
        assertThat(report.issuesFound()).isEmpty();
        assertThat(report.recommendations()).isEmpty();
        assertThat(report.manualReviewRequired()).isFalse();
        assertThat(report.checks()).extracting(QualityCheckResult::checkType).containsExactly(
                "document_verification", "data_accuracy", "compliance_check", "policy_adherence",
                "risk_validation", "calculation_verification", "regulatory_compliance");
        assertThat(report.checkedAt()).isEqualTo(QualityFixtures.CLOCK.instant());
    }

    @Test
    @DisplayName("Approved amount above the policy income multiple costs 30 points and fails the report")
    void amountAbovePolicyMultiple() {
        // Given: personal loan limit is 60x monthly income = 1,800,000
        BigDecimal amount = new BigDecimal("2000000");
        BigDecimal rate = new BigDecimal("12");
        LoanApplicationSnapshot application = cleanApplication()
                .monthlyIncome(new BigDecimal("30000"))
                .loanAmount(amount)
                .build();
        CreditDecision decision = cleanApproval()
                .approvedLoanAmount(amount)
                .monthlyEmi(CalculationVerificationCheck.calculateEmi(amount, 60, rate))
                .build();

        // When
        QualityReport report = aggregator.evaluate(application, decision, List.of());

        // Then
        QualityCheckResult policy = check(report, QualityCheckType.POLICY_ADHERENCE);
        assertThat(policy.score()).isEqualTo(70);
        assertThat(policy.status()).isEqualTo(QualityStatus.WARNING);
        assertThat(policy.issues()).singleElement()
                .satisfies(issue -> assertThat(issue.severity()).isEqualTo(IssueSeverity.CRITICAL));
        assertThat(report.overallStatus()).isEqualTo(QualityStatus.FAILED);
        assertThat(report.manualReviewRequired()).isTrue();
    }

    @Test
    @DisplayName("Policy check fails once its score drops below 70")
    void policyCheckFailsBelowSeventy() {
        BigDecimal amount = new BigDecimal("2000000");
        BigDecimal rate = new BigDecimal("26");
        CreditDecision decision = cleanApproval()
                .approvedLoanAmount(amount)
                .interestRate(rate)
                .monthlyEmi(CalculationVerificationCheck.calculateEmi(amount, 60, rate))
                .build();

        QualityReport report = aggregator.evaluate(
                cleanApplication().monthlyIncome(new BigDecimal("30000")).loanAmount(amount).build(),
                decision, List.of());

        QualityCheckResult policy = check(report, QualityCheckType.POLICY_ADHERENCE);
        assertThat(policy.score()).isEqualTo(55);
        assertThat(policy.status()).isEqualTo(QualityStatus.FAILED);
    }

    @Test
    @DisplayName("Any critical issue fails the report and critical issues sort first")
    void criticalIssuesFailAndSortFirst() {
        // Missing mandatory bank statement (critical) plus an invalid email (warning)
        LoanApplicationSnapshot application = cleanApplication()
                .email("not-an-email")
                .documents(QualityFixtures.standardDocuments().subList(0, 3))
                .build();

        QualityReport report = aggregator.evaluate(application, cleanApproval().build(), null);

        assertThat(report.overallStatus()).isEqualTo(QualityStatus.FAILED);
        assertThat(report.issuesFound()).hasSize(2);
        assertThat(report.issuesFound().get(0).severity()).isEqualTo(IssueSeverity.CRITICAL);
        assertThat(report.issuesFound().get(0).checkType()).isEqualTo("document_verification");
        assertThat(report.issuesFound().get(1).severity()).isEqualTo(IssueSeverity.WARNING);
        assertThat(report.recommendations()).extracting(Recommendation::type)
                .containsExactly(Recommendation.Type.DOCUMENT_COLLECTION, Recommendation.Type.GENERAL_REVIEW);
        assertThat(report.recommendations().get(0).priority()).isEqualTo(Recommendation.Priority.HIGH);
        assertThat(report.criticalIssueCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Requested extra checks are recorded as passed with score 100")
    void extraChecksRecordedAsPassed() {
        QualityReport report = aggregator.evaluate(cleanApplication().build(), cleanApproval().build(),
                List.of("fraud_screen", " "));

        assertThat(report.checks()).hasSize(8);
        QualityCheckResult extra = report.checks().get(7);
        assertThat(extra.checkType()).isEqualTo("fraud_screen");
        assertThat(extra.status()).isEqualTo(QualityStatus.PASSED);
        assertThat(extra.score()).isEqualTo(100);
        assertThat(report.complianceScore()).isEqualTo(100);
    }

    @Test
    @DisplayName("Conditional approvals are checked; rejections are not applicable")
    void onlyApprovedDecisionsAreChecked() {
        CreditDecision conditional = cleanApproval()
                .finalDecision(CreditDecision.FinalDecision.CONDITIONAL_APPROVAL)
                .build();
        assertThat(aggregator.evaluate(cleanApplication().build(), conditional, null).overallStatus())
                .isEqualTo(QualityStatus.PASSED);

        CreditDecision rejected = cleanApproval().finalDecision(CreditDecision.FinalDecision.REJECTED).build();
        assertThatThrownBy(() -> aggregator.evaluate(cleanApplication().build(), rejected, null))
                .isInstanceOf(QualityCheckNotApplicableException.class);
        assertThatThrownBy(() -> aggregator.evaluate(cleanApplication().build(), null, null))
                .isInstanceOf(QualityCheckNotApplicableException.class);
    }

    @Test
    @DisplayName("Risk concerns require manual review without failing the report")
    void riskConcernsRequireReview() {
        CreditDecision decision = cleanApproval().dtiRatio(new BigDecimal("0.55")).build();

        QualityReport report = aggregator.evaluate(cleanApplication().build(), decision, null);

        QualityCheckResult risk = check(report, QualityCheckType.RISK_VALIDATION);
        assertThat(risk.score()).isEqualTo(90);
        assertThat(risk.manualReviewRequired()).isTrue();
        assertThat(report.manualReviewRequired()).isTrue();
        assertThat(report.overallStatus()).isEqualTo(QualityStatus.PASSED);
    }

    @Test
    @DisplayName("Low composite scores without failures give WARNING")
    void lowCompositeGivesWarning() {
        List<QualityCheckResult> results = List.of(
                QualityCheckResult.of(QualityCheckType.COMPLIANCE_CHECK, 75, List.of()),
                QualityCheckResult.of(QualityCheckType.DATA_ACCURACY, 95, List.of()));

        assertThat(QualityAggregator.compositeScore(results, QualityCheckType.ScoreGroup.COMPLIANCE)).isEqualTo(75);
        assertThat(QualityAggregator.overallStatus(results, List.of(), 75, 95)).isEqualTo(QualityStatus.WARNING);
        assertThat(QualityAggregator.overallStatus(results, List.of(), 85, 95)).isEqualTo(QualityStatus.PASSED);
    }

    @Test
    @DisplayName("Composite score is the rounded mean of the group's check scores")
    void compositeScoreRoundsMean() {
        List<QualityCheckResult> results = List.of(
                QualityCheckResult.of(QualityCheckType.COMPLIANCE_CHECK, 100, List.of()),
                QualityCheckResult.of(QualityCheckType.POLICY_ADHERENCE, 85, List.of()),
                QualityCheckResult.of(QualityCheckType.REGULATORY_COMPLIANCE, 90, List.of()),
                QualityCheckResult.of(QualityCheckType.RISK_VALIDATION, 10, List.of()));

        // (100 + 85 + 90) / 3 = 91.67; risk validation belongs to no group
        assertThat(QualityAggregator.compositeScore(results, QualityCheckType.ScoreGroup.COMPLIANCE)).isEqualTo(92);
        assertThat(QualityAggregator.compositeScore(results, QualityCheckType.ScoreGroup.ACCURACY)).isZero();
    }
}
