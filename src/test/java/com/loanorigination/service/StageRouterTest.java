package com.loanorigination.service;

import com.loanorigination.exception.InvalidStageException;
import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;
import com.loanorigination.model.WorkflowType;
import com.loanorigination.quality.QualityStatus;
import com.loanorigination.rules.Decision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageRouterTest {

    private final StageRouter router = new StageRouter();

    @Test
    @DisplayName("Approval moves to the next stage of the workflow as PENDING")
    void approveMovesForward() {
        assertThat(router.route(WorkflowType.AUTOMATED, Stage.PRE_QUALIFICATION, Decision.APPROVE))
                .contains(new StageRouter.Route(Stage.APPLICATION_PROCESSING, StageStatus.PENDING));
        assertThat(router.route(WorkflowType.DASHBOARD_DRIVEN, Stage.UNDERWRITING, Decision.APPROVE))
                .contains(new StageRouter.Route(Stage.CREDIT_DECISION, StageStatus.PENDING));
    }

    @Test
    @DisplayName("Conditional approval moves forward as IN_PROGRESS")
    void conditionalMovesForwardInProgress() {
        assertThat(router.route(WorkflowType.HYBRID, Stage.CREDIT_DECISION, Decision.CONDITIONAL))
                .contains(new StageRouter.Route(Stage.QUALITY_CHECK, StageStatus.IN_PROGRESS));
    }

    @Test
    @DisplayName("The last working stage advances to COMPLETED")
    void lastStageCompletes() {
        assertThat(router.route(WorkflowType.AUTOMATED, Stage.LOAN_FUNDING, Decision.APPROVE))
                .contains(new StageRouter.Route(Stage.COMPLETED, StageStatus.PENDING));
    }

    @Test
    @DisplayName("Rejection from any working stage goes to REJECTED")
    void rejectGoesToRejected() {
        assertThat(router.route(WorkflowType.DASHBOARD_DRIVEN, Stage.KYC_VERIFICATION, Decision.REJECT))
                .contains(new StageRouter.Route(Stage.REJECTED, StageStatus.REJECTED));
    }

    @Test
    @DisplayName("PENDING holds the application where it is")
    void pendingStays() {
        assertThat(router.route(WorkflowType.AUTOMATED, Stage.UNDERWRITING, Decision.PENDING)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = Stage.class, names = {"COMPLETED", "REJECTED", "CANCELLED"})
    @DisplayName("Terminal stages never route")
    void terminalStagesNeverRoute(Stage terminal) {
        assertThat(router.route(WorkflowType.AUTOMATED, terminal, Decision.APPROVE)).isEmpty();
        assertThat(router.route(WorkflowType.AUTOMATED, terminal, Decision.REJECT)).isEmpty();
    }

    @Test
    @DisplayName("Routing forward from a stage outside the workflow is rejected")
    void foreignStageRejected() {
        assertThatThrownBy(() -> router.route(WorkflowType.AUTOMATED, Stage.KYC_VERIFICATION, Decision.APPROVE))
                .isInstanceOf(InvalidStageException.class)
                .hasMessageContaining("KYC_VERIFICATION");
    }

    @Test
    @DisplayName("Quality status maps onto the routing decision")
    void qualityGate() {
        assertThat(StageRouter.decisionFor(QualityStatus.PASSED)).isEqualTo(Decision.APPROVE);
        assertThat(StageRouter.decisionFor(QualityStatus.WARNING)).isEqualTo(Decision.CONDITIONAL);
        assertThat(StageRouter.decisionFor(QualityStatus.FAILED)).isEqualTo(Decision.PENDING);
    }
}
