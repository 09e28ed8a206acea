package com.loanorigination.model;

import java.time.Duration;

/**
 * Review urgency and the time allowed before a task is overdue.
 */
public enum ReviewPriority {
    URGENT(Duration.ofHours(4)),
    HIGH(Duration.ofHours(12)),
    NORMAL(Duration.ofHours(24)),
    LOW(Duration.ofHours(48));

    private final Duration turnaround;

    ReviewPriority(Duration turnaround) {
        this.turnaround = turnaround;
    }

    public Duration getTurnaround() {
        return turnaround;
    }
}
