package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Audit record of a stage or workflow change. Insert-only.
 *
 * The creation record has no from-stage; a workflow switch has
 * fromStage == toStage.
 */
@Entity
@Immutable
@Table(name = "workflow_transitions",
       indexes = @Index(name = "idx_transition_application", columnList = "applicationId"))
@Data
@NoArgsConstructor
public class WorkflowTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String applicationId;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private Stage fromStage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Stage toStage;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private StageStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private StageStatus toStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private WorkflowType workflowType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TriggerType triggerType;

    @Column(nullable = false, updatable = false)
    private String triggeredBy;

    @Column(updatable = false, length = 1000)
    private String reason;

    @Column(nullable = false, updatable = false)
    private Instant transitionedAt;
}
