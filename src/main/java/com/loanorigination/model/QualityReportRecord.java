package com.loanorigination.model;

import com.loanorigination.quality.QualityStatus;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted quality report. Immutable once written; the full report is kept
 * as JSON next to the columns used for querying.
 */
@Entity
@Table(name = "quality_reports",
       indexes = @Index(name = "idx_quality_report_application", columnList = "applicationId"))
@Data
@NoArgsConstructor
public class QualityReportRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String applicationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QualityStatus overallStatus;

    @Column(nullable = false)
    private Integer complianceScore;

    @Column(nullable = false)
    private Integer accuracyScore;

    @Column(nullable = false)
    private Boolean manualReviewRequired;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String report;

    @Column(nullable = false)
    private Instant checkedAt;
}
