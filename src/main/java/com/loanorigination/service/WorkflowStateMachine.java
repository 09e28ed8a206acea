package com.loanorigination.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanorigination.config.KafkaTopics;
import com.loanorigination.config.RedisConfig;
import com.loanorigination.config.WorkflowProperties;
import com.loanorigination.event.WorkflowTransitioned;
import com.loanorigination.exception.ApplicationNotFoundException;
import com.loanorigination.exception.InvalidStageException;
import com.loanorigination.exception.TransitionConflictException;
import com.loanorigination.model.LoanApplication;
import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;
import com.loanorigination.model.TriggerType;
import com.loanorigination.model.WorkflowState;
import com.loanorigination.model.WorkflowTransition;
import com.loanorigination.model.WorkflowType;
import com.loanorigination.quality.QualityReport;
import com.loanorigination.repository.LoanApplicationRepository;
import com.loanorigination.repository.WorkflowStateRepository;
import com.loanorigination.repository.WorkflowTransitionRepository;
import com.loanorigination.rules.Decision;
import com.loanorigination.rules.ExecutionResult;
import com.loanorigination.rules.RuleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stage workflow of loan applications.
 *
 * TRANSITION ATOMICITY:
 * =====================
 * A transition is one database transaction:
 * 1. Lock the application row (SELECT ... FOR UPDATE)
 * 2. Update the application's stage and status, flushed immediately so a
 *    stale version fails before anything else is written
 * 3. Complete the open WorkflowState, storing the decision payload
 * 4. Open a WorkflowState for the new stage at the next stage order
 *    (none for terminal stages)
 * 5. Append the WorkflowTransition
 * 6. Queue a manual review task (dashboard-driven workflows only)
 * 7. Write the WorkflowTransitioned event and the audit entry to the outbox
 *
 * Any failure rolls the whole unit back. Nobody ever observes an
 * application between two stages.
 *
 * CONCURRENCY:
 * ============
 * The row lock serializes transitions per application; applications do not
 * contend with each other. A lock timeout, a version mismatch or a repeat of
 * the transition just applied surfaces as {@link TransitionConflictException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowStateMachine {

    static final String SYSTEM_ACTOR = "system";
    private static final DateTimeFormatter NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final LoanApplicationRepository applicationRepository;
    private final WorkflowStateRepository stateRepository;
    private final WorkflowTransitionRepository transitionRepository;
    private final ManualReviewQueueService reviewQueueService;
    private final AuditTrailService auditTrailService;
    private final OutboxService outboxService;
    private final StageRouter stageRouter;
    private final WorkflowProperties workflowProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Opens a new application at the first stage of {@code workflowType}.
     *
     * @param data opaque applicant and loan data, stored as JSON
     */
    @Transactional
    public CreatedApplication createApplication(WorkflowType workflowType, Map<String, Object> data, String createdBy) {
        if (workflowType == null) {
            throw new IllegalArgumentException("Workflow type is required");
        }
        String actor = actorOrSystem(createdBy);
        Instant now = Instant.now(clock);
        Stage initialStage = workflowType.initialStage();

        LoanApplication application = new LoanApplication();
        application.setApplicationId(UUID.randomUUID().toString());
        application.setApplicationNumber(newApplicationNumber(now));
        application.setWorkflowType(workflowType);
        application.setCurrentStage(initialStage);
        application.setCurrentStatus(StageStatus.PENDING);
        application.setApplicationData(toJson(data == null ? Map.of() : data));
        application.setCreatedBy(actor);
        application.setUpdatedBy(actor);
        application.setCreatedAt(now);
        application.setUpdatedAt(now);
        application = applicationRepository.save(application);

        openState(application, initialStage, StageStatus.PENDING, 1, now);
        recordTransition(application, null, null, TriggerType.AUTOMATIC, actor,
                "Application created", now);

        log.info("Created application {} ({}) in {} workflow at {}",
                application.getApplicationId(), application.getApplicationNumber(), workflowType, initialStage);

        return new CreatedApplication(application.getApplicationId(), application.getApplicationNumber(),
                workflowType, initialStage);
    }

    /**
     * Moves the application to {@code newStage} with {@code newStatus}.
     *
     * @param decision payload recorded on the stage being completed
     * @throws ApplicationNotFoundException no such application
     * @throws InvalidStageException        the application is in a terminal stage, or
     *                                      {@code newStage} is not part of its workflow
     * @throws TransitionConflictException  another transition holds the lock, changed the
     *                                      row underneath, or already applied this one
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#applicationId")
    public TransitionResult transitionToNextStage(String applicationId, Stage newStage, StageStatus newStatus,
                                                  Map<String, Object> decision, String triggeredBy) {
        if (newStage == null || newStatus == null) {
            throw new IllegalArgumentException("Target stage and status are required");
        }
        try {
            LoanApplication application = lockApplication(applicationId);
            return applyTransition(application, newStage, newStatus, decision, actorOrSystem(triggeredBy));
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            log.warn("Transition of {} to {} lost a race: {}", applicationId, newStage, e.getMessage());
            throw new TransitionConflictException(applicationId,
                    "Concurrent transition on application " + applicationId, e);
        }
    }

    /**
     * Routes a rule engine result from the application's current stage.
     * The decision, score and fired rules become the stage's decision payload.
     *
     * @return the applied transition, or empty when the decision is PENDING
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#applicationId")
    public Optional<TransitionResult> advance(String applicationId, ExecutionResult result, String triggeredBy) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("decision", result.decision().name());
        payload.put("score", result.score());
        payload.put("firedRules", result.firedRuleIds());
        payload.put("failedRules", result.failed().stream().map(RuleOutcome::ruleId).toList());
        return route(applicationId, result.decision(), payload, triggeredBy);
    }

    /**
     * Quality gate: passed moves on, warning moves on conditionally, failed
     * holds the application where it is for manual review.
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#applicationId")
    public Optional<TransitionResult> advanceAfterQualityCheck(String applicationId, QualityReport report,
                                                               String triggeredBy) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("decision", report.overallStatus().name());
        payload.put("complianceScore", report.complianceScore());
        payload.put("accuracyScore", report.accuracyScore());
        payload.put("manualReviewRequired", report.manualReviewRequired());
        return route(applicationId, StageRouter.decisionFor(report.overallStatus()), payload, triggeredBy);
    }

    /**
     * Changes the workflow type, keeping stage and status. The switch is
     * recorded as a transition from the current stage to itself, and the open
     * WorkflowState takes the new type and processing method.
     *
     * @throws InvalidStageException       the application is in a terminal stage, or
     *                                     its current stage is not part of {@code newType}
     * @throws TransitionConflictException the application already uses {@code newType}
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#applicationId")
    public TransitionResult switchWorkflowType(String applicationId, WorkflowType newType, String reason,
                                               String triggeredBy) {
        if (newType == null) {
            throw new IllegalArgumentException("Workflow type is required");
        }
        String actor = actorOrSystem(triggeredBy);
        try {
            LoanApplication application = lockApplication(applicationId);
            WorkflowType previous = application.getWorkflowType();
            Stage stage = application.getCurrentStage();

            if (stage.isTerminal()) {
                throw new InvalidStageException(
                        "Application " + applicationId + " is already in terminal stage " + stage);
            }
            if (previous == newType) {
                throw new TransitionConflictException(applicationId,
                        "Application " + applicationId + " already uses the " + newType + " workflow");
            }
            if (!newType.accepts(stage)) {
                throw new InvalidStageException(
                        "Stage " + stage + " is not part of the " + newType + " workflow");
            }
            Instant now = Instant.now(clock);

            application.setWorkflowType(newType);
            application.setUpdatedBy(actor);
            application.setUpdatedAt(now);
            applicationRepository.saveAndFlush(application);

            for (WorkflowState open : stateRepository.findByApplicationIdAndStatusNotOrderByStageOrderAsc(
                    applicationId, StageStatus.COMPLETED)) {
                open.setWorkflowType(newType);
                open.setProcessingMethod(newType.processingMethod());
                stateRepository.save(open);
            }

            String switchReason = "Workflow switched: " + previous + " -> " + newType + ". Reason: " + reason;
            recordTransition(application, application.getCurrentStage(), application.getCurrentStatus(),
                    TriggerType.MANUAL, actor, switchReason, now);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", previous.name());
            details.put("to", newType.name());
            details.put("reason", reason);
            auditTrailService.record(applicationId, "WORKFLOW_SWITCHED", actor, details);

            log.info("Switched application {} from {} to {} workflow", applicationId, previous, newType);
            return new TransitionResult(applicationId, application.getCurrentStage(), application.getCurrentStage(),
                    application.getCurrentStatus(), application.getCurrentStatus());

        } catch (ConcurrencyFailureException e) {
            throw new TransitionConflictException(applicationId,
                    "Concurrent update of application " + applicationId, e);
        }
    }

    private Optional<TransitionResult> route(String applicationId, Decision decision,
                                             Map<String, Object> payload, String triggeredBy) {
        try {
            LoanApplication application = lockApplication(applicationId);
            Optional<StageRouter.Route> route = stageRouter.route(
                    application.getWorkflowType(), application.getCurrentStage(), decision);

            if (route.isEmpty()) {
                log.info("Application {} stays at {} (decision {})",
                        applicationId, application.getCurrentStage(), decision);
                return Optional.empty();
            }
            return Optional.of(applyTransition(application, route.get().stage(), route.get().status(),
                    payload, actorOrSystem(triggeredBy)));

        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            throw new TransitionConflictException(applicationId,
                    "Concurrent transition on application " + applicationId, e);
        }
    }

    private TransitionResult applyTransition(LoanApplication application, Stage newStage, StageStatus newStatus,
                                             Map<String, Object> decision, String actor) {
        String applicationId = application.getApplicationId();
        Stage fromStage = application.getCurrentStage();
        StageStatus fromStatus = application.getCurrentStatus();
        WorkflowType workflowType = application.getWorkflowType();

        if (fromStage.isTerminal()) {
            throw new InvalidStageException(
                    "Application " + applicationId + " is already in terminal stage " + fromStage);
        }
        if (!workflowType.accepts(newStage)) {
            throw new InvalidStageException(
                    "Stage " + newStage + " is not part of the " + workflowType + " workflow");
        }
        if (fromStage == newStage && fromStatus == newStatus) {
            throw new TransitionConflictException(applicationId,
                    "Application " + applicationId + " is already at " + newStage + " (" + newStatus + ")");
        }

        Instant now = Instant.now(clock);

        application.setCurrentStage(newStage);
        application.setCurrentStatus(newStatus);
        application.setUpdatedBy(actor);
        application.setUpdatedAt(now);
        applicationRepository.saveAndFlush(application);

        completeOpenStates(applicationId, decision, now);
        if (!newStage.isTerminal()) {
            int nextOrder = stateRepository.findMaxStageOrder(applicationId) + 1;
            openState(application, newStage, newStatus, nextOrder, now);
        }

        recordTransition(application, fromStage, fromStatus, triggerTypeFor(actor), actor,
                reasonOf(decision), now);

        if (workflowType.usesReviewQueue() && newStage.requiresManualReview()) {
            reviewQueueService.enqueue(application, newStage);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fromStage", fromStage.name());
        details.put("toStage", newStage.name());
        details.put("toStatus", newStatus.name());
        details.put("decision", decision);
        auditTrailService.record(applicationId, "STAGE_TRANSITION", actor, details);

        log.info("Application {} moved {} ({}) -> {} ({}) by {}",
                applicationId, fromStage, fromStatus, newStage, newStatus, actor);

        return new TransitionResult(applicationId, fromStage, newStage, fromStatus, newStatus);
    }

    private LoanApplication lockApplication(String applicationId) {
        return applicationRepository
                .findByIdForUpdate(applicationId, workflowProperties.getTransitionLockTimeoutMs())
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    private void completeOpenStates(String applicationId, Map<String, Object> decision, Instant now) {
        List<WorkflowState> open = stateRepository
                .findByApplicationIdAndStatusNotOrderByStageOrderAsc(applicationId, StageStatus.COMPLETED);

        String stageResult = decision == null ? null : toJson(decision);
        for (WorkflowState state : open) {
            state.setStatus(StageStatus.COMPLETED);
            state.setCompletedAt(now);
            state.setStageResult(stageResult);
            if (decision != null) {
                Object value = decision.get("decision");
                state.setDecision(value == null ? null : value.toString());
                Object reason = decision.get("reason");
                state.setDecisionReason(reason == null ? null : reason.toString());
            }
            stateRepository.save(state);
        }
    }

    private void openState(LoanApplication application, Stage stage, StageStatus status, int order, Instant now) {
        WorkflowState state = new WorkflowState();
        state.setApplicationId(application.getApplicationId());
        state.setWorkflowType(application.getWorkflowType());
        state.setStage(stage);
        state.setStageOrder(order);
        state.setStatus(status);
        state.setProcessingMethod(application.getWorkflowType().processingMethod());
        state.setStartedAt(now);
        stateRepository.saveAndFlush(state);
    }

    private void recordTransition(LoanApplication application, Stage fromStage, StageStatus fromStatus,
                                  TriggerType triggerType, String actor, String reason, Instant now) {
        WorkflowTransition transition = new WorkflowTransition();
        transition.setApplicationId(application.getApplicationId());
        transition.setFromStage(fromStage);
        transition.setToStage(application.getCurrentStage());
        transition.setFromStatus(fromStatus);
        transition.setToStatus(application.getCurrentStatus());
        transition.setWorkflowType(application.getWorkflowType());
        transition.setTriggerType(triggerType);
        transition.setTriggeredBy(actor);
        transition.setReason(reason);
        transition.setTransitionedAt(now);
        transitionRepository.save(transition);

        WorkflowTransitioned event = new WorkflowTransitioned(
                UUID.randomUUID().toString(),
                application.getApplicationId(),
                application.getApplicationNumber(),
                fromStage,
                application.getCurrentStage(),
                fromStatus,
                application.getCurrentStatus(),
                application.getWorkflowType(),
                triggerType,
                actor,
                reason,
                now);
        outboxService.enqueue(event.eventId(), event.applicationId(), KafkaTopics.WORKFLOW_TRANSITIONED, event);
    }

    private String newApplicationNumber(Instant now) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "LOS-" + NUMBER_DATE.format(now.atZone(ZoneOffset.UTC)) + "-" + suffix;
    }

    private static TriggerType triggerTypeFor(String actor) {
        return SYSTEM_ACTOR.equals(actor) ? TriggerType.AUTOMATIC : TriggerType.MANUAL;
    }

    private static String actorOrSystem(String actor) {
        return actor == null || actor.isBlank() ? SYSTEM_ACTOR : actor;
    }

    private static String reasonOf(Map<String, Object> decision) {
        if (decision == null) {
            return null;
        }
        Object reason = decision.get("reason");
        return reason == null ? null : reason.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Decision payload is not serializable", e);
        }
    }
}
