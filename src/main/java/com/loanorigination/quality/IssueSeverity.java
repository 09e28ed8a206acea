package com.loanorigination.quality;

/**
 * Severity of a quality issue. Higher rank sorts first.
 */
public enum IssueSeverity {
    CRITICAL(3),
    WARNING(2),
    INFO(1);

    private final int rank;

    IssueSeverity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
