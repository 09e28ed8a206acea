package com.loanorigination.exception;

/**
 * Quality checks only run against approved or conditionally approved
 * credit decisions.
 */
public class QualityCheckNotApplicableException extends LoanOriginationException {

    public QualityCheckNotApplicableException(String message) {
        super(message);
    }
}
