package com.loanorigination.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanorigination.config.KafkaTopics;
import com.loanorigination.config.RedisConfig;
import com.loanorigination.event.QualityCheckCompleted;
import com.loanorigination.model.QualityReportRecord;
import com.loanorigination.quality.CreditDecision;
import com.loanorigination.quality.LoanApplicationSnapshot;
import com.loanorigination.quality.QualityAggregator;
import com.loanorigination.quality.QualityReport;
import com.loanorigination.repository.QualityReportRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the quality aggregator for an application and keeps the reports.
 *
 * Every evaluation is stored; the latest one is served from the
 * {@code quality-reports} cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityReportService {

    private final QualityAggregator qualityAggregator;
    private final QualityReportRecordRepository reportRepository;
    private final OutboxService outboxService;
    private final AuditTrailService auditTrailService;
    private final ObjectMapper objectMapper;

    @Transactional
    @CachePut(value = RedisConfig.QUALITY_REPORTS_CACHE, key = "#application.applicationId()")
    public QualityReport evaluateAndRecord(LoanApplicationSnapshot application, CreditDecision decision,
                                           List<String> extraChecks, String actor) {
        QualityReport report = qualityAggregator.evaluate(application, decision, extraChecks);

        QualityReportRecord record = new QualityReportRecord();
        record.setApplicationId(report.applicationId());
        record.setOverallStatus(report.overallStatus());
        record.setComplianceScore(report.complianceScore());
        record.setAccuracyScore(report.accuracyScore());
        record.setManualReviewRequired(report.manualReviewRequired());
        record.setReport(toJson(report));
        record.setCheckedAt(report.checkedAt());
        reportRepository.save(record);

        QualityCheckCompleted event = new QualityCheckCompleted(
                UUID.randomUUID().toString(),
                report.applicationId(),
                report.overallStatus(),
                report.complianceScore(),
                report.accuracyScore(),
                report.criticalIssueCount(),
                report.manualReviewRequired(),
                report.checkedAt());
        outboxService.enqueue(event.eventId(), event.applicationId(), KafkaTopics.QUALITY_CHECK_COMPLETED, event);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("overallStatus", report.overallStatus().name());
        details.put("complianceScore", report.complianceScore());
        details.put("accuracyScore", report.accuracyScore());
        details.put("issues", report.issuesFound().size());
        auditTrailService.record(report.applicationId(), "QUALITY_CHECK", actor, details);

        return report;
    }

    @Cacheable(value = RedisConfig.QUALITY_REPORTS_CACHE, key = "#applicationId", unless = "#result == null")
    @Transactional(readOnly = true)
    public QualityReport getLatestReport(String applicationId) {
        return reportRepository.findFirstByApplicationIdOrderByCheckedAtDescIdDesc(applicationId)
                .map(this::fromRecord)
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public List<QualityReport> getReportHistory(String applicationId) {
        return reportRepository.findByApplicationIdOrderByCheckedAtAscIdAsc(applicationId).stream()
                .map(this::fromRecord)
                .toList();
    }

    private QualityReport fromRecord(QualityReportRecord record) {
        try {
            return objectMapper.readValue(record.getReport(), QualityReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored quality report " + record.getId() + " is unreadable", e);
        }
    }

    private String toJson(QualityReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize quality report for " + report.applicationId(), e);
        }
    }
}
