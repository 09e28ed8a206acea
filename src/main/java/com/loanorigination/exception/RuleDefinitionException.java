package com.loanorigination.exception;

/**
 * Thrown when a rule is registered without an id, condition or action,
 * with an id already used by the engine, or with an expression that does
 * not parse.
 */
public class RuleDefinitionException extends LoanOriginationException {

    public RuleDefinitionException(String message) {
        super(message);
    }

    public RuleDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
