package com.loanorigination.exception;

/**
 * Root of the exceptions raised by the rule engine, the quality aggregator
 * and the workflow state machine.
 *
 * Persistence failures are not wrapped: they surface as Spring's
 * {@link org.springframework.dao.DataAccessException} so callers see the
 * original cause.
 */
public class LoanOriginationException extends RuntimeException {

    public LoanOriginationException(String message) {
        super(message);
    }

    public LoanOriginationException(String message, Throwable cause) {
        super(message, cause);
    }
}
