package com.loanorigination.exception;

public class ApplicationNotFoundException extends LoanOriginationException {

    public ApplicationNotFoundException(String applicationId) {
        super("Application not found: " + applicationId);
    }
}
