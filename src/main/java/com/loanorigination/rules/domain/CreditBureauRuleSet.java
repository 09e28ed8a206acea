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
import static com.loanorigination.rules.domain.CreditBureauThresholds.SCORE_CEILING;
import static com.loanorigination.rules.domain.CreditBureauThresholds.SCORE_FLOOR;

/**
 * Score banding, delinquency, utilization and enquiry rules over a bureau report.
 */
public final class CreditBureauRuleSet {

    public static final String ENGINE_NAME = "credit-bureau";

    private CreditBureauRuleSet() {
    }

    public static RuleEngine<CreditBureauSnapshot> create(CreditBureauThresholds thresholds) {
        return new RuleEngine<>(ENGINE_NAME, rules(thresholds));
    }

    static List<Rule<CreditBureauSnapshot>> rules(CreditBureauThresholds t) {
        return List.of(
                Rule.of("CB_001", "Invalid Score", REJECT, CRITICAL, 0,
                        "Bureau score outside " + SCORE_FLOOR + "-" + SCORE_CEILING,
                        s -> s.cibilScore() != null
                                && (s.cibilScore() < SCORE_FLOOR || s.cibilScore() > SCORE_CEILING)),
                Rule.of("CB_002", "Excellent Score", APPROVE, POSITIVE, 40,
                        "Bureau score " + t.excellentCibilScore() + " or above",
                        s -> inRange(s.cibilScore()) && s.cibilScore() >= t.excellentCibilScore()),
                Rule.of("CB_003", "Good Score", APPROVE, POSITIVE, 25,
                        "Bureau score between " + t.minCibilScore() + " and " + t.excellentCibilScore(),
                        s -> inRange(s.cibilScore())
                                && s.cibilScore() >= t.minCibilScore()
                                && s.cibilScore() < t.excellentCibilScore()),
                Rule.of("CB_004", "Score Below Minimum", REJECT, HIGH, -50,
                        "Bureau score below " + t.minCibilScore(),
                        s -> inRange(s.cibilScore()) && s.cibilScore() < t.minCibilScore()),
                Rule.of("CB_005", "New To Credit", CONDITIONAL, MEDIUM, 0,
                        "No bureau score on record",
                        "cibil_score == null"),
                Rule.of("CB_006", "Clean Repayment", APPROVE, POSITIVE, 20,
                        "No delinquencies on record",
                        "dpd_count == 0"),
                Rule.of("CB_007", "Minor Delinquency", CONDITIONAL, MEDIUM, -10,
                        "Past delinquencies within " + t.maxDpdDays() + " days past due",
                        s -> s.dpdCount() != null && s.dpdCount() > 0
                                && (s.maxDpdDays() == null || s.maxDpdDays() <= t.maxDpdDays())),
                Rule.of("CB_008", "Serious Delinquency", REJECT, HIGH, -40,
                        "Delinquency beyond " + t.maxDpdDays() + " days past due",
                        s -> s.maxDpdDays() != null && s.maxDpdDays() > t.maxDpdDays()),
                Rule.of("CB_009", "Short Credit History", FLAG, LOW, -5,
                        "Credit history shorter than " + t.minHistoryMonths() + " months",
                        s -> s.creditHistoryMonths() != null && s.creditHistoryMonths() < t.minHistoryMonths()),
                Rule.of("CB_010", "High Utilization", CONDITIONAL, MEDIUM, -10,
                        "Credit utilization above " + t.maxUtilizationRatio(),
                        s -> s.utilizationRatio() != null
                                && s.utilizationRatio().compareTo(t.maxUtilizationRatio()) > 0),
                Rule.of("CB_011", "Credit Hungry", FLAG, LOW, -5,
                        "More than " + t.maxRecentInquiries() + " recent enquiries",
                        s -> s.recentInquiries() != null && s.recentInquiries() > t.maxRecentInquiries()),
                Rule.of("CB_012", "Written-off Accounts", REJECT, CRITICAL, -60,
                        "Written-off or settled accounts on record",
                        "written_off_accounts > 0")
        );
    }

    private static boolean inRange(Integer score) {
        return score != null && score >= SCORE_FLOOR && score <= SCORE_CEILING;
    }
}
