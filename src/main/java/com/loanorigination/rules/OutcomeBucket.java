package com.loanorigination.rules;

/**
 * Result list an outcome lands in when its condition holds.
 */
public enum OutcomeBucket {
    PASSED,
    FAILED,
    WARNINGS,
    FLAGS
}
