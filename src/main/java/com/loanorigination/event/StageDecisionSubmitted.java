package com.loanorigination.event;

import com.loanorigination.model.Stage;
import com.loanorigination.model.StageStatus;

import java.time.Instant;
import java.util.Map;

/**
 * A phase controller's decision for an application: move it to
 * {@code stage} with {@code status}, recording {@code decision} on the
 * stage being left.
 *
 * Consumed from {@code loan.stage.decisions}. {@code eventId} is the
 * deduplication key.
 */
public record StageDecisionSubmitted(
    String eventId,
    String applicationId,
    Stage stage,
    StageStatus status,
    Map<String, Object> decision,
    String triggeredBy,
    Instant submittedAt
) {
    public StageDecisionSubmitted {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("Application ID cannot be null or empty");
        }
        if (stage == null || status == null) {
            throw new IllegalArgumentException("Stage and status are required");
        }
        decision = decision == null ? Map.of() : decision;
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = "system";
        }
        if (submittedAt == null) {
            submittedAt = Instant.now();
        }
    }
}
