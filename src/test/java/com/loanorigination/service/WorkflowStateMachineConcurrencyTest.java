package com.loanorigination.service;

import com.loanorigination.exception.TransitionConflictException;
import com.loanorigination.model.LoanApplication;
import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;
import com.loanorigination.model.WorkflowState;
import com.loanorigination.model.WorkflowType;
import com.loanorigination.repository.LoanApplicationRepository;
import com.loanorigination.repository.OutboxEventRepository;
import com.loanorigination.repository.WorkflowStateRepository;
import com.loanorigination.repository.WorkflowTransitionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Runs outside a test transaction so every call commits or rolls back on
 * its own, as it does in production.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import(WorkflowTestConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class WorkflowStateMachineConcurrencyTest {

    @Autowired
    private WorkflowStateMachine stateMachine;

    @Autowired
    private LoanApplicationRepository applicationRepository;

    @Autowired
    private WorkflowStateRepository stateRepository;

    @Autowired
    private WorkflowTransitionRepository transitionRepository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @MockBean
    private ManualReviewQueueService reviewQueueService;

    @Test
    @DisplayName("Two concurrent identical transitions: exactly one applies, the other conflicts")
    void concurrentTransitionsSerialize() throws Exception {
        // Given
        String applicationId = stateMachine.createApplication(WorkflowType.AUTOMATED, Map.of(), "system")
                .applicationId();
        CountDownLatch start = new CountDownLatch(1);
        Callable<TransitionResult> transition = () -> {
            start.await();
            return stateMachine.transitionToNextStage(applicationId, Stage.APPLICATION_PROCESSING,
                    StageStatus.PENDING, Map.of("decision", "APPROVE"), "system");
        };

        // When
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<TransitionResult>> futures = new ArrayList<>();
        try {
            futures.add(executor.submit(transition));
            futures.add(executor.submit(transition));
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // Then
        int applied = 0;
        int conflicts = 0;
        for (Future<TransitionResult> future : futures) {
            try {
                future.get();
                applied++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(TransitionConflictException.class);
                conflicts++;
            }
        }
        assertThat(applied).isEqualTo(1);
        assertThat(conflicts).isEqualTo(1);

        assertThat(stateRepository.findByApplicationIdOrderByStageOrderAsc(applicationId))
                .extracting(WorkflowState::getStageOrder)
                .containsExactly(1, 2);
        assertThat(transitionRepository.countByApplicationId(applicationId)).isEqualTo(2);
        assertThat(applicationRepository.findById(applicationId).orElseThrow().getCurrentStage())
                .isEqualTo(Stage.APPLICATION_PROCESSING);
    }

    @Test
    @DisplayName("A failure after the stage update rolls back every write of the transition")
    void failedTransitionRollsBack() {
        // Given
        String applicationId = stateMachine.createApplication(WorkflowType.DASHBOARD_DRIVEN, Map.of(), "officer.rao")
                .applicationId();
        when(reviewQueueService.enqueue(any(LoanApplication.class), any(Stage.class)))
                .thenThrow(new IllegalStateException("review queue unavailable"));

        // When
        assertThatThrownBy(() -> stateMachine.transitionToNextStage(applicationId, Stage.INITIAL_REVIEW,
                StageStatus.PENDING, Map.of("decision", "APPROVE"), "officer.rao"))
                .isInstanceOf(IllegalStateException.class);

        // Then
        LoanApplication application = applicationRepository.findById(applicationId).orElseThrow();
        assertThat(application.getCurrentStage()).isEqualTo(Stage.APPLICATION_SUBMITTED);
        assertThat(application.getCurrentStatus()).isEqualTo(StageStatus.PENDING);
        assertThat(stateRepository.findByApplicationIdOrderByStageOrderAsc(applicationId))
                .singleElement()
                .satisfies(state -> assertThat(state.getStatus()).isEqualTo(StageStatus.PENDING));
        assertThat(transitionRepository.countByApplicationId(applicationId)).isEqualTo(1);
        assertThat(outboxEventRepository.findByAggregateIdOrderByIdAsc(applicationId)).hasSize(1);
    }
}
