package com.loanorigination.exception;

import lombok.Getter;

/**
 * Another transition on the same application is in flight or has already
 * been applied. Not retried internally: the caller decides.
 */
@Getter
public class TransitionConflictException extends LoanOriginationException {

    private final String applicationId;

    public TransitionConflictException(String applicationId, String message) {
        super(message);
        this.applicationId = applicationId;
    }

    public TransitionConflictException(String applicationId, String message, Throwable cause) {
        super(message, cause);
        this.applicationId = applicationId;
    }
}
