package com.loanorigination.rules;

/**
 * Categorical outcome of a rule evaluation.
 */
public enum Decision {
    APPROVE,
    REJECT,
    CONDITIONAL,
    PENDING  // nothing fired
}
