package com.loanorigination.service;

import com.loanorigination.exception.InvalidStageException;
import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;
import com.loanorigination.model.WorkflowType;
import com.loanorigination.quality.QualityStatus;
import com.loanorigination.rules.Decision;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a rule engine decision at the current stage to the stage and status
 * the application moves to.
 *
 * <pre>
 * APPROVE     -> next stage, PENDING
 * CONDITIONAL -> next stage, IN_PROGRESS
 * REJECT      -> REJECTED, REJECTED
 * PENDING     -> stay (no transition)
 * </pre>
 *
 * The stage after the last one in a workflow's list is COMPLETED. Routing
 * forward from a stage outside the workflow's list throws
 * {@link InvalidStageException}.
 */
@Component
public class StageRouter {

    public record Route(Stage stage, StageStatus status) {
    }

    public Optional<Route> route(WorkflowType workflowType, Stage currentStage, Decision decision) {
        if (currentStage.isTerminal()) {
            return Optional.empty();
        }
        return switch (decision) {
            case APPROVE -> Optional.of(new Route(next(workflowType, currentStage), StageStatus.PENDING));
            case CONDITIONAL -> Optional.of(new Route(next(workflowType, currentStage), StageStatus.IN_PROGRESS));
            case REJECT -> Optional.of(new Route(Stage.REJECTED, StageStatus.REJECTED));
            case PENDING -> Optional.empty();
        };
    }

    /**
     * Quality gate: a failed report holds the application for manual review.
     */
    public static Decision decisionFor(QualityStatus status) {
        return switch (status) {
            case PASSED -> Decision.APPROVE;
            case WARNING -> Decision.CONDITIONAL;
            case FAILED -> Decision.PENDING;
        };
    }

    private static Stage next(WorkflowType workflowType, Stage currentStage) {
        if (!workflowType.getStages().contains(currentStage)) {
            // e.g. a dashboard stage left in place by a switch to the automated vocabulary
            throw new InvalidStageException(
                    "Stage " + currentStage + " is not part of the " + workflowType + " workflow");
        }
        return workflowType.nextStage(currentStage).orElse(Stage.COMPLETED);
    }
}
