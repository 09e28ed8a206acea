package com.loanorigination.rules.expression;

/**
 * Raised while evaluating a parsed expression against a snapshot.
 * Never escapes {@link ExpressionCondition}.
 */
class ExpressionEvaluationException extends RuntimeException {

    ExpressionEvaluationException(String message) {
        super(message);
    }
}
