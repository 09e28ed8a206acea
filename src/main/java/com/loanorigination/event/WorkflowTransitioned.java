package com.loanorigination.event;

import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;
import com.loanorigination.model.TriggerType;
import com.loanorigination.model.WorkflowType;

import java.time.Instant;

/**
 * Published for every stage change, for the creation of an application and
 * for a workflow type switch.
 *
 * {@code fromStage} is null only for the creation record. A switch carries
 * {@code fromStage == toStage}.
 */
public record WorkflowTransitioned(
    String eventId,
    String applicationId,
    String applicationNumber,
    Stage fromStage,
    Stage toStage,
    StageStatus fromStatus,
    StageStatus toStatus,
    WorkflowType workflowType,
    TriggerType triggerType,
    String triggeredBy,
    String reason,
    Instant occurredAt
) {
    public WorkflowTransitioned {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("Application ID cannot be null or empty");
        }
        if (toStage == null || toStatus == null) {
            throw new IllegalArgumentException("Target stage and status are required");
        }
        if (workflowType == null) {
            throw new IllegalArgumentException("Workflow type cannot be null");
        }
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
    }
}
