package com.loanorigination.service;

import com.loanorigination.model.OutboxEvent;
import com.loanorigination.model.QualityReportRecord;
import com.loanorigination.quality.CreditDecision;
import com.loanorigination.quality.LoanApplicationSnapshot;
import com.loanorigination.quality.QualityAggregator;
import com.loanorigination.quality.QualityFixtures;
import com.loanorigination.quality.QualityReport;
import com.loanorigination.quality.QualityStatus;
import com.loanorigination.quality.checks.CalculationVerificationCheck;
import com.loanorigination.quality.checks.ComplianceCheck;
import com.loanorigination.quality.checks.DataAccuracyCheck;
import com.loanorigination.quality.checks.DocumentVerificationCheck;
import com.loanorigination.quality.checks.PolicyAdherenceCheck;
import com.loanorigination.quality.checks.RegulatoryComplianceCheck;
import com.loanorigination.quality.checks.RiskValidationCheck;
import com.loanorigination.repository.OutboxEventRepository;
import com.loanorigination.repository.QualityReportRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import({
        WorkflowTestConfig.class,
        QualityReportService.class,
        QualityAggregator.class,
        DocumentVerificationCheck.class,
        DataAccuracyCheck.class,
        ComplianceCheck.class,
        PolicyAdherenceCheck.class,
        RiskValidationCheck.class,
        CalculationVerificationCheck.class,
        RegulatoryComplianceCheck.class
})
class QualityReportServiceTest {

    private static final String APPLICATION_ID = "APP-QR-1";

    @Autowired
    private QualityReportService qualityReportService;

    @Autowired
    private QualityReportRecordRepository reportRepository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    private final LoanApplicationSnapshot application =
            QualityFixtures.cleanApplication().applicationId(APPLICATION_ID).build();

    @Test
    @DisplayName("An evaluation is stored, announced and audited in one transaction")
    void evaluateAndRecord() {
        // When
        QualityReport report = qualityReportService.evaluateAndRecord(application,
                QualityFixtures.cleanApproval().build(), List.of(), "qc.analyst");

        // Then
        assertThat(report.overallStatus()).isEqualTo(QualityStatus.PASSED);
        assertThat(report.checkedAt()).isEqualTo(WorkflowTestConfig.NOW);

        List<QualityReportRecord> records = reportRepository.findByApplicationIdOrderByCheckedAtAscIdAsc(APPLICATION_ID);
        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.getOverallStatus()).isEqualTo(QualityStatus.PASSED);
            assertThat(record.getComplianceScore()).isEqualTo(100);
            assertThat(record.getManualReviewRequired()).isFalse();
        });

        assertThat(outboxEventRepository.findByAggregateIdOrderByIdAsc(APPLICATION_ID))
                .extracting(OutboxEvent::getEventType)
                .containsExactly("QualityCheckCompleted", "AuditEvent");
    }

    @Test
    @DisplayName("Stored reports read back intact, latest first")
    void latestReportAndHistory() {
        QualityReport first = qualityReportService.evaluateAndRecord(application,
                QualityFixtures.cleanApproval().build(), null, "qc.analyst");
        CreditDecision mismatchedEmi = QualityFixtures.cleanApproval().monthlyEmi(new BigDecimal("12000")).build();
        QualityReport second = qualityReportService.evaluateAndRecord(application, mismatchedEmi, null, "qc.analyst");

        assertThat(second.overallStatus()).isEqualTo(QualityStatus.FAILED);
        assertThat(qualityReportService.getLatestReport(APPLICATION_ID)).isEqualTo(second);
        assertThat(qualityReportService.getReportHistory(APPLICATION_ID)).containsExactly(first, second);
        assertThat(qualityReportService.getLatestReport("APP-UNKNOWN")).isNull();
    }
}
