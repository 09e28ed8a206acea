package com.loanorigination.quality;

import java.time.LocalDate;

/**
 * Inputs shared by every check in one evaluation.
 */
public record QualityCheckContext(
        LoanApplicationSnapshot application,
        CreditDecision decision,
        LoanProductPolicy policy,
        LocalDate today
) {
}
