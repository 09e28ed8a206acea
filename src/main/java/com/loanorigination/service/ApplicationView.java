package com.loanorigination.service;

import com.loanorigination.model.LoanApplication;
import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;
import com.loanorigination.model.WorkflowType;

import java.time.Instant;

/**
 * Read model of an application header, as served from the cache.
 */
public record ApplicationView(
    String applicationId,
    String applicationNumber,
    WorkflowType workflowType,
    Stage currentStage,
    StageStatus currentStatus,
    String createdBy,
    String updatedBy,
    Instant createdAt,
    Instant updatedAt
) {
    public static ApplicationView from(LoanApplication application) {
        return new ApplicationView(
                application.getApplicationId(),
                application.getApplicationNumber(),
                application.getWorkflowType(),
                application.getCurrentStage(),
                application.getCurrentStatus(),
                application.getCreatedBy(),
                application.getUpdatedBy(),
                application.getCreatedAt(),
                application.getUpdatedAt());
    }
}
