package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One stage visit of an application. Completed states stay as history.
 *
 * The unique (applicationId, stageOrder) constraint backs the ordering
 * guarantee at the database level: two writers racing for the same next
 * order cannot both commit.
 */
@Entity
@Table(name = "workflow_states",
       uniqueConstraints = @UniqueConstraint(name = "uk_workflow_state_order",
               columnNames = {"applicationId", "stageOrder"}),
       indexes = @Index(name = "idx_workflow_state_application", columnList = "applicationId"))
@Data
@NoArgsConstructor
public class WorkflowState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String applicationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowType workflowType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Stage stage;

    @Column(nullable = false)
    private Integer stageOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProcessingMethod processingMethod;

    private String decision;

    @Column(length = 1000)
    private String decisionReason;

    /**
     * Decision payload recorded when the stage completed, as JSON
     */
    @Column(columnDefinition = "TEXT")
    private String stageResult;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    public boolean isActive() {
        return status != StageStatus.COMPLETED;
    }
}
