package com.loanorigination.rules.domain;

import com.loanorigination.rules.Rule;
import com.loanorigination.rules.RuleEngine;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

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
 * Income stability, surplus, banking conduct, debt burden, sector and fraud rules.
 */
public final class RiskRuleSet {

    public static final String ENGINE_NAME = "risk";

    static final BigDecimal LOW_VARIANCE = new BigDecimal("0.10");
    static final BigDecimal MODERATE_VARIANCE = new BigDecimal("0.20");
    static final BigDecimal LOW_DTI = new BigDecimal("0.30");
    static final BigDecimal MODERATE_DTI = new BigDecimal("0.50");

    private static final List<String> STABLE_SECTORS =
            List.of("government", "psu", "banking", "it", "healthcare", "education");
    private static final List<String> VOLATILE_SECTORS =
            List.of("real estate", "construction", "hospitality", "travel", "entertainment");

    private RiskRuleSet() {
    }

    public static RuleEngine<RiskSnapshot> create(RiskThresholds thresholds) {
        return new RuleEngine<>(ENGINE_NAME, rules(thresholds));
    }

    static List<Rule<RiskSnapshot>> rules(RiskThresholds t) {
        return List.of(
                Rule.of("RISK_001", "Low Income Variance", APPROVE, POSITIVE, 25,
                        "Income variance at most 10%, stable income pattern",
                        s -> s.incomeVariance() != null && s.incomeVariance().compareTo(LOW_VARIANCE) <= 0),
                Rule.of("RISK_002", "Moderate Income Variance", CONDITIONAL, LOW, 10,
                        "Income variance between 10% and 20%",
                        s -> between(s.incomeVariance(), LOW_VARIANCE, MODERATE_VARIANCE)),
                Rule.of("RISK_003", "High Income Variance", CONDITIONAL, MEDIUM, -10,
                        "Income variance above 20%, additional verification required",
                        s -> between(s.incomeVariance(), MODERATE_VARIANCE, t.maxIncomeVariance())),
                Rule.of("RISK_004", "Very High Income Variance", REJECT, HIGH, -40,
                        "Income variance above " + t.maxIncomeVariance() + ", possible income misrepresentation",
                        s -> s.incomeVariance() != null && s.incomeVariance().compareTo(t.maxIncomeVariance()) > 0),
                Rule.of("RISK_005", "Healthy Monthly Surplus", APPROVE, POSITIVE, 20,
                        "Monthly surplus of 20,000 or more",
                        "monthly_surplus >= 20000"),
                Rule.of("RISK_006", "Insufficient Monthly Surplus", REJECT, HIGH, -40,
                        "Monthly surplus below 5,000",
                        "monthly_surplus < 5000"),
                Rule.of("RISK_007", "No Bounces", APPROVE, POSITIVE, 20,
                        "No bounced payments in six months",
                        "bounces_last_6_months == 0"),
                Rule.of("RISK_008", "Some Bounces", CONDITIONAL, MEDIUM, -5,
                        "Bounced payments in six months within tolerance",
                        s -> s.bouncesLastSixMonths() != null && s.bouncesLastSixMonths() > 0
                                && s.bouncesLastSixMonths() <= t.maxBouncesSixMonths()),
                Rule.of("RISK_009", "Frequent Bounces", REJECT, HIGH, -40,
                        "More than " + t.maxBouncesSixMonths() + " bounced payments in six months",
                        s -> s.bouncesLastSixMonths() != null && s.bouncesLastSixMonths() > t.maxBouncesSixMonths()),
                Rule.of("RISK_010", "Low DTI", APPROVE, POSITIVE, 20,
                        "Debt-to-income at most 30%",
                        s -> s.dtiRatio() != null && s.dtiRatio().compareTo(LOW_DTI) <= 0),
                Rule.of("RISK_011", "Moderate DTI", CONDITIONAL, MEDIUM, 5,
                        "Debt-to-income between 30% and 50%",
                        s -> between(s.dtiRatio(), LOW_DTI, MODERATE_DTI)),
                Rule.of("RISK_012", "High DTI", CONDITIONAL, HIGH, -15,
                        "Debt-to-income above 50%, high debt burden",
                        s -> between(s.dtiRatio(), MODERATE_DTI, t.maxDtiRatio())),
                Rule.of("RISK_013", "Excessive DTI", REJECT, HIGH, -50,
                        "Debt-to-income above " + t.maxDtiRatio(),
                        s -> s.dtiRatio() != null && s.dtiRatio().compareTo(t.maxDtiRatio()) > 0),
                Rule.of("RISK_014", "Stable Sector", APPROVE, POSITIVE, 10,
                        "Employment in a stable sector",
                        s -> sectorIn(s.employmentSector(), STABLE_SECTORS)),
                Rule.of("RISK_015", "Volatile Sector", FLAG, MEDIUM, -5,
                        "Employment in a volatile sector",
                        s -> sectorIn(s.employmentSector(), VOLATILE_SECTORS)),
                Rule.of("RISK_016", "Excessive Loan To Income", REJECT, HIGH, -30,
                        "Requested amount above " + t.maxLoanToIncomeMultiple() + "x annual income",
                        s -> s.loanToIncomeMultiple() != null
                                && s.loanToIncomeMultiple().compareTo(t.maxLoanToIncomeMultiple()) > 0),
                Rule.of("RISK_017", "Fraud Indicators", REJECT, CRITICAL, -100,
                        "Fraud indicators present",
                        "fraud_indicator_count > 0"),
                Rule.of("RISK_018", "Document Tampering", REJECT, CRITICAL, -100,
                        "Submitted documents show signs of tampering",
                        "document_tampering == true")
        );
    }

    // (lower, upper]
    private static boolean between(BigDecimal value, BigDecimal lower, BigDecimal upper) {
        return value != null && value.compareTo(lower) > 0 && value.compareTo(upper) <= 0;
    }

    private static boolean sectorIn(String sector, List<String> sectors) {
        if (sector == null || sector.isBlank()) {
            return false;
        }
        String normalized = sector.toLowerCase(Locale.ROOT).trim();
        return sectors.stream().anyMatch(normalized::equals);
    }
}
