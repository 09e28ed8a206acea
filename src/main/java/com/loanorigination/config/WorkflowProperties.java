package com.loanorigination.config;

import com.loanorigination.model.ReviewPriority;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Workflow settings, bound from {@code loan.workflow.*}.
 */
@ConfigurationProperties(prefix = "loan.workflow")
@Validated
@Data
public class WorkflowProperties {

    /**
     * Priority of review tasks enqueued by stage transitions
     */
    @NotNull
    private ReviewPriority defaultReviewPriority = ReviewPriority.NORMAL;

    /**
     * How long a transition waits for the application row lock before
     * reporting a conflict
     */
    @Positive
    private long transitionLockTimeoutMs = 3000;
}
