package com.loanorigination.exception;

import lombok.Getter;

/**
 * Failure of a single rule's condition. The engine catches it and records a
 * failed outcome for that rule; it never aborts an evaluation.
 */
@Getter
public class ConditionEvaluationException extends LoanOriginationException {

    private final String ruleId;

    public ConditionEvaluationException(String ruleId, Throwable cause) {
        super("Rule " + ruleId + " execution failed: " + cause.getMessage(), cause);
        this.ruleId = ruleId;
    }
}
