package com.loanorigination.model;

public enum ReviewTaskStatus {
    PENDING,
    ASSIGNED,
    COMPLETED
}
