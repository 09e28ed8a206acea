package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Application header: where the application currently is.
 *
 * The row is the serialization point for transitions. The state machine
 * reads it with a pessimistic write lock and {@code version} catches any
 * writer that bypasses the lock.
 */
@Entity
@Table(name = "loan_applications")
@Data
@NoArgsConstructor
public class LoanApplication {

    @Id
    private String applicationId;

    /**
     * Human-readable reference, e.g. LOS-20240115-1a2b3c4d
     */
    @Column(nullable = false, unique = true)
    private String applicationNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowType workflowType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Stage currentStage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageStatus currentStatus;

    /**
     * Opaque applicant and loan data as submitted, serialized as JSON
     */
    @Column(columnDefinition = "TEXT")
    private String applicationData;

    @Column(nullable = false)
    private String createdBy;

    private String updatedBy;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @Version
    private Long version;
}
