package com.loanorigination.service;

import com.loanorigination.model.Stage;
import com.loanorigination.model.WorkflowType;

public record CreatedApplication(
    String applicationId,
    String applicationNumber,
    WorkflowType workflowType,
    Stage initialStage
) {
}
