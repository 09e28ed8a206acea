package com.loanorigination.quality;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Application facts the quality checks read. Monetary values are in rupees.
 */
@Builder
public record LoanApplicationSnapshot(
        String applicationId,
        String fullName,
        String email,
        String mobile,
        String panNumber,
        LocalDate dateOfBirth,
        BigDecimal monthlyIncome,
        BigDecimal existingEmi,
        String loanType,
        BigDecimal loanAmount,
        Integer tenureMonths,
        List<SubmittedDocument> documents
) {
    public LoanApplicationSnapshot {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
