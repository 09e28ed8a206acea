package com.loanorigination.exception;

/**
 * Target stage does not belong to the application's workflow vocabulary.
 */
public class InvalidStageException extends LoanOriginationException {

    public InvalidStageException(String message) {
        super(message);
    }
}
