package com.loanorigination.service;

import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;

/**
 * Outcome of an applied transition.
 */
public record TransitionResult(
    String applicationId,
    Stage fromStage,
    Stage toStage,
    StageStatus fromStatus,
    StageStatus toStatus
) {
}
