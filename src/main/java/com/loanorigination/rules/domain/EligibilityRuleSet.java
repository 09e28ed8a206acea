package com.loanorigination.rules.domain;

import com.loanorigination.rules.Rule;
import com.loanorigination.rules.RuleEngine;

import java.util.List;

import static com.loanorigination.rules.RuleAction.APPROVE;
import static com.loanorigination.rules.RuleAction.CONDITIONAL;
import static com.loanorigination.rules.RuleAction.FLAG;
import static com.loanorigination.rules.RuleAction.REJECT;
import static com.loanorigination.rules.Severity.CRITICAL;
import static com.loanorigination.rules.Severity.HIGH;
import static com.loanorigination.rules.Severity.LOW;
import static com.loanorigination.rules.Severity.MEDIUM;
import static com.loanorigination.rules.Severity.POSITIVE;

/**
 * Age, income, employment stability, amount, purpose and geography rules.
 */
public final class EligibilityRuleSet {

    public static final String ENGINE_NAME = "eligibility";

    // Months in the current job (salaried) or in business (self-employed, professional)
    static final int MIN_SALARIED_TENURE_MONTHS = 6;
    static final int MIN_BUSINESS_VINTAGE_MONTHS = 24;
    static final int STABLE_EMPLOYMENT_MONTHS = 24;

    private EligibilityRuleSet() {
    }

    public static RuleEngine<EligibilitySnapshot> create(EligibilityThresholds thresholds) {
        return new RuleEngine<>(ENGINE_NAME, rules(thresholds));
    }

    static List<Rule<EligibilitySnapshot>> rules(EligibilityThresholds t) {
        return List.of(
                Rule.of("ELIG_001", "Below Minimum Age", REJECT, CRITICAL, -50,
                        "Applicant must be at least " + t.minAge(),
                        s -> s.age() != null && s.age() < t.minAge()),
                Rule.of("ELIG_002", "Above Maximum Age", REJECT, HIGH, -50,
                        "Applicant must be at most " + t.maxAge(),
                        s -> s.age() != null && s.age() > t.maxAge()),
                Rule.of("ELIG_003", "Age Eligible", APPROVE, POSITIVE, 15,
                        "Applicant age within " + t.minAge() + "-" + t.maxAge(),
                        s -> s.age() != null && s.age() >= t.minAge() && s.age() <= t.maxAge()),
                Rule.of("ELIG_004", "Income Below Minimum", REJECT, HIGH, -30,
                        "Monthly income below the minimum for the employment type",
                        s -> s.monthlyIncome() != null
                                && s.monthlyIncome().compareTo(t.minimumIncomeFor(s.employmentType())) < 0),
                Rule.of("ELIG_005", "Income Eligible", APPROVE, POSITIVE, 20,
                        "Monthly income meets the minimum for the employment type",
                        s -> s.monthlyIncome() != null
                                && s.monthlyIncome().compareTo(t.minimumIncomeFor(s.employmentType())) >= 0),
                Rule.of("ELIG_006", "Short Employment Tenure", CONDITIONAL, MEDIUM, -5,
                        "Employment or business vintage below the required minimum",
                        s -> s.currentEmploymentMonths() != null
                                && s.currentEmploymentMonths() < requiredTenure(s.employmentType())),
                Rule.of("ELIG_007", "Stable Employment", APPROVE, POSITIVE, 10,
                        "Stable employment for " + STABLE_EMPLOYMENT_MONTHS + " months or more",
                        "current_employment_months >= " + STABLE_EMPLOYMENT_MONTHS),
                Rule.of("ELIG_008", "Amount Below Minimum", REJECT, HIGH, -20,
                        "Requested amount below " + t.minLoanAmount().toPlainString(),
                        s -> s.requestedAmount() != null && s.requestedAmount().compareTo(t.minLoanAmount()) < 0),
                Rule.of("ELIG_009", "Amount Above Maximum", REJECT, HIGH, -30,
                        "Requested amount above " + t.maxLoanAmount().toPlainString(),
                        s -> s.requestedAmount() != null && s.requestedAmount().compareTo(t.maxLoanAmount()) > 0),
                Rule.of("ELIG_010", "Amount Within Limits", APPROVE, POSITIVE, 10,
                        "Requested amount within product limits",
                        s -> s.requestedAmount() != null
                                && s.requestedAmount().compareTo(t.minLoanAmount()) >= 0
                                && s.requestedAmount().compareTo(t.maxLoanAmount()) <= 0),
                Rule.of("ELIG_011", "Prohibited Purpose", REJECT, CRITICAL, -100,
                        "Loan purpose is not permitted",
                        "loan_purpose == 'speculation' || loan_purpose == 'gambling' || loan_purpose == 'illegal_activity'"),
                Rule.of("ELIG_012", "Purpose Not Stated", FLAG, LOW, 0,
                        "Loan purpose not provided",
                        "loan_purpose == null"),
                Rule.of("ELIG_013", "Non-serviceable Location", REJECT, HIGH, -25,
                        "Applicant location is outside the serviceable area",
                        "serviceable_area == false")
        );
    }

    private static int requiredTenure(EmploymentType type) {
        return type == EmploymentType.SALARIED ? MIN_SALARIED_TENURE_MONTHS : MIN_BUSINESS_VINTAGE_MONTHS;
    }
}
