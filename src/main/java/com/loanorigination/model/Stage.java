package com.loanorigination.model;

/**
 * Every stage name used by any workflow type, plus the terminal stages.
 *
 * Stages that need human judgement carry the review queue they feed.
 * Only dashboard-driven workflows act on it.
 */
public enum Stage {
    // Automated
    PRE_QUALIFICATION(null),
    APPLICATION_PROCESSING(null),
    QUALITY_CHECK(null),

    // Dashboard-driven
    APPLICATION_SUBMITTED(null),
    INITIAL_REVIEW(ReviewType.VERIFICATION),
    KYC_VERIFICATION(ReviewType.VERIFICATION),
    EMPLOYMENT_VERIFICATION(ReviewType.VERIFICATION),
    FINANCIAL_ASSESSMENT(ReviewType.UNDERWRITING),
    CREDIT_EVALUATION(ReviewType.UNDERWRITING),
    APPROVAL_PROCESSING(ReviewType.FINAL_APPROVAL),

    // Shared
    UNDERWRITING(ReviewType.UNDERWRITING),
    CREDIT_DECISION(null),
    LOAN_FUNDING(null),

    // Terminal
    COMPLETED(null),
    REJECTED(null),
    CANCELLED(null);

    private final ReviewType reviewType;

    Stage(ReviewType reviewType) {
        this.reviewType = reviewType;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED || this == CANCELLED;
    }

    public boolean requiresManualReview() {
        return reviewType != null;
    }

    /**
     * @return the review queue, or {@code null} when the stage needs no review
     */
    public ReviewType getReviewType() {
        return reviewType;
    }
}
