package com.loanorigination.service;

import com.loanorigination.config.WorkflowProperties;
import com.loanorigination.model.LoanApplication;
import com.loanorigination.model.ManualReviewTask;
import com.loanorigination.model.ReviewPriority;
import com.loanorigination.model.ReviewTaskStatus;
import com.loanorigination.model.ReviewType;
import com.loanorigination.model.Stage;
import com.loanorigination.repository.ManualReviewTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Review queues worked by employees on the dashboard. One queue per
 * {@link ReviewType}; a stage maps to its queue through
 * {@link Stage#getReviewType()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualReviewQueueService {

    private final ManualReviewTaskRepository taskRepository;
    private final WorkflowProperties workflowProperties;
    private final Clock clock;

    /**
     * Adds a task for {@code application} at {@code stage} with the default
     * priority. Re-entering a stage reopens its existing task instead of
     * adding a second one.
     *
     * @throws IllegalArgumentException if the stage needs no review
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ManualReviewTask enqueue(LoanApplication application, Stage stage) {
        return enqueue(application, stage, workflowProperties.getDefaultReviewPriority());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ManualReviewTask enqueue(LoanApplication application, Stage stage, ReviewPriority priority) {
        if (!stage.requiresManualReview()) {
            throw new IllegalArgumentException("Stage " + stage + " does not require manual review");
        }

        Instant now = Instant.now(clock);
        ManualReviewTask task = taskRepository
                .findByApplicationIdAndStage(application.getApplicationId(), stage)
                .orElseGet(ManualReviewTask::new);

        task.setApplicationId(application.getApplicationId());
        task.setApplicationNumber(application.getApplicationNumber());
        task.setStage(stage);
        task.setReviewType(stage.getReviewType());
        task.setPriority(priority);
        task.setStatus(ReviewTaskStatus.PENDING);
        task.setAssignedTo(null);
        task.setCreatedAt(now);
        task.setDueAt(now.plus(priority.getTurnaround()));

        ManualReviewTask saved = taskRepository.save(task);
        log.info("Queued {} review for {} at {} (priority {}, due {})",
                saved.getReviewType(), application.getApplicationId(), stage, priority, saved.getDueAt());
        return saved;
    }

    /**
     * Open tasks of one queue, earliest due first.
     */
    @Transactional(readOnly = true)
    public List<ManualReviewTask> pendingTasks(ReviewType reviewType) {
        return taskRepository.findByReviewTypeAndStatusOrderByDueAtAsc(reviewType, ReviewTaskStatus.PENDING);
    }
}
