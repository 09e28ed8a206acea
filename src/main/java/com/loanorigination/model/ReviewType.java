package com.loanorigination.model;

/**
 * Manual review queue a task lands in.
 */
public enum ReviewType {
    VERIFICATION,
    UNDERWRITING,
    FINAL_APPROVAL
}
