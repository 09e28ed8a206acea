package com.loanorigination.rules.domain;

import com.loanorigination.rules.RuleSnapshot;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

@Builder
public record EligibilitySnapshot(
        Integer age,
        String loanType,
        EmploymentType employmentType,
        BigDecimal monthlyIncome,
        Integer currentEmploymentMonths,
        BigDecimal requestedAmount,
        String loanPurpose,
        Boolean serviceableArea
) implements RuleSnapshot {

    @Override
    public Map<String, Object> fields() {
        return SnapshotFields.builder()
                .put("age", age)
                .put("loan_type", loanType)
                .put("employment_type", employmentType)
                .put("monthly_income", monthlyIncome)
                .put("current_employment_months", currentEmploymentMonths)
                .put("requested_amount", requestedAmount)
                .put("loan_purpose", loanPurpose)
                .put("serviceable_area", serviceableArea)
                .build();
    }
}
