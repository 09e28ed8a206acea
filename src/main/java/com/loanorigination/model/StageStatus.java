package com.loanorigination.model;

/**
 * Processing state within a stage.
 */
public enum StageStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    REJECTED
}
