package com.loanorigination.quality;

/**
 * One independently scored quality check. Implementations start from 100
 * and subtract fixed penalties per violation.
 */
public interface QualityCheck {

    QualityCheckType type();

    QualityCheckResult run(QualityCheckContext context);
}
