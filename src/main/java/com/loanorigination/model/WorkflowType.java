package com.loanorigination.model;

import java.util.List;
import java.util.Optional;

/**
 * Operating mode of an application.
 *
 * AUTOMATED:        rule engines drive every stage
 * DASHBOARD_DRIVEN: employees drive stages through the review queue
 * HYBRID:           automated stage vocabulary, employee-processed, no review queue
 */
public enum WorkflowType {
    AUTOMATED(List.of(
            Stage.PRE_QUALIFICATION,
            Stage.APPLICATION_PROCESSING,
            Stage.UNDERWRITING,
            Stage.CREDIT_DECISION,
            Stage.QUALITY_CHECK,
            Stage.LOAN_FUNDING,
            Stage.COMPLETED)),

    DASHBOARD_DRIVEN(List.of(
            Stage.APPLICATION_SUBMITTED,
            Stage.INITIAL_REVIEW,
            Stage.KYC_VERIFICATION,
            Stage.EMPLOYMENT_VERIFICATION,
            Stage.FINANCIAL_ASSESSMENT,
            Stage.CREDIT_EVALUATION,
            Stage.UNDERWRITING,
            Stage.CREDIT_DECISION,
            Stage.APPROVAL_PROCESSING,
            Stage.LOAN_FUNDING,
            Stage.COMPLETED)),

    HYBRID(AUTOMATED.stages);

    private final List<Stage> stages;

    WorkflowType(List<Stage> stages) {
        this.stages = stages;
    }

    public List<Stage> getStages() {
        return stages;
    }

    public Stage initialStage() {
        return stages.get(0);
    }

    /**
     * A stage is valid for the workflow if it is in its vocabulary or terminal.
     */
    public boolean accepts(Stage stage) {
        return stage != null && (stage.isTerminal() || stages.contains(stage));
    }

    /**
     * Stage after {@code current} in this workflow's order, empty for terminal
     * or unknown stages.
     */
    public Optional<Stage> nextStage(Stage current) {
        int index = stages.indexOf(current);
        if (index < 0 || index + 1 >= stages.size()) {
            return Optional.empty();
        }
        return Optional.of(stages.get(index + 1));
    }

    public ProcessingMethod processingMethod() {
        return this == AUTOMATED ? ProcessingMethod.AUTOMATED : ProcessingMethod.MANUAL;
    }

    public boolean usesReviewQueue() {
        return this == DASHBOARD_DRIVEN;
    }
}
