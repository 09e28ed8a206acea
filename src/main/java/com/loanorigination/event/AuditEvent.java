package com.loanorigination.event;

import java.time.Instant;
import java.util.Map;

/**
 * Structured audit record: who did what, with which details, when.
 */
public record AuditEvent(
    String eventId,
    String applicationId,
    String action,
    String actor,
    Map<String, Object> details,
    Instant timestamp
) {
    public AuditEvent {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Audit action cannot be null or empty");
        }
        if (actor == null || actor.isBlank()) {
            actor = "system";
        }
        details = details == null ? Map.of() : details;
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
