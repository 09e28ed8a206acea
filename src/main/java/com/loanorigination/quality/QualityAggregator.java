package com.loanorigination.quality;

import com.loanorigination.exception.QualityCheckNotApplicableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Runs every quality check against an approved application and rolls the
 * results into one report.
 *
 * COMPOSITE SCORES:
 * =================
 * - complianceScore = rounded mean of compliance, policy and regulatory checks
 * - accuracyScore   = rounded mean of data accuracy, calculation and document checks
 *
 * OVERALL STATUS:
 * ===============
 * FAILED  if any check failed or any issue is critical
 * WARNING if either composite score is below 80
 * PASSED  otherwise
 *
 * Checks are pure functions of their inputs; the aggregator holds no state
 * between evaluations.
 */
@Service
@Slf4j
public class QualityAggregator {

    static final int COMPOSITE_WARNING_THRESHOLD = 80;

    private final List<QualityCheck> checks;
    private final Clock clock;

    public QualityAggregator(List<QualityCheck> checks, Clock clock) {
        this.checks = checks.stream()
                .sorted(Comparator.comparing(QualityCheck::type))
                .toList();
        this.clock = clock;
    }

    /**
     * @param extraChecks additional check names requested by the caller;
     *                    each is recorded as passed with score 100
     * @throws QualityCheckNotApplicableException if the decision is neither
     *                                            approved nor conditionally approved
     */
    public QualityReport evaluate(LoanApplicationSnapshot application, CreditDecision decision,
                                  List<String> extraChecks) {
        if (decision == null || !decision.isApproved()) {
            throw new QualityCheckNotApplicableException(
                    "Quality check only applicable for approved applications");
        }

        QualityCheckContext context = new QualityCheckContext(application, decision,
                LoanProductPolicy.forLoanType(application.loanType()), LocalDate.now(clock));

        List<QualityCheckResult> results = new ArrayList<>();
        for (QualityCheck check : checks) {
            QualityCheckResult result = check.run(context);
            log.debug("Quality check {} for application {}: status={}, score={}, issues={}",
                    result.checkType(), application.applicationId(), result.status(), result.score(),
                    result.issues().size());
            results.add(result);
        }
        if (extraChecks != null) {
            extraChecks.stream()
                    .filter(name -> name != null && !name.isBlank())
                    .map(QualityCheckResult::extra)
                    .forEach(results::add);
        }

        int complianceScore = compositeScore(results, QualityCheckType.ScoreGroup.COMPLIANCE);
        int accuracyScore = compositeScore(results, QualityCheckType.ScoreGroup.ACCURACY);
        List<QualityIssue> issues = collectIssues(results);
        QualityStatus overallStatus = overallStatus(results, issues, complianceScore, accuracyScore);
        List<Recommendation> recommendations = issues.stream().map(Recommendation::forIssue).toList();
        boolean manualReview = results.stream().anyMatch(QualityCheckResult::manualReviewRequired)
                || issues.stream().anyMatch(QualityIssue::isCritical);

        QualityReport report = new QualityReport(application.applicationId(), overallStatus,
                complianceScore, accuracyScore, results, issues, recommendations, manualReview,
                clock.instant());

        log.info("Quality evaluation for application {}: status={}, compliance={}, accuracy={}, issues={}, "
                        + "manualReview={}",
                application.applicationId(), overallStatus, complianceScore, accuracyScore,
                issues.size(), manualReview);
        return report;
    }

    static int compositeScore(List<QualityCheckResult> results, QualityCheckType.ScoreGroup group) {
        Predicate<QualityCheckResult> inGroup = result -> {
            QualityCheckType type = QualityCheckType.fromValue(result.checkType());
            return type != null && type.getGroup() == group;
        };
        List<QualityCheckResult> relevant = results.stream().filter(inGroup).toList();
        if (relevant.isEmpty()) {
            return 0;
        }
        int total = relevant.stream().mapToInt(QualityCheckResult::score).sum();
        return (int) Math.round(total / (double) relevant.size());
    }

    // Stable sort, so issues of equal severity keep check order.
    static List<QualityIssue> collectIssues(List<QualityCheckResult> results) {
        List<QualityIssue> issues = new ArrayList<>();
        for (QualityCheckResult result : results) {
            result.issues().forEach(issue -> issues.add(issue.withCheckType(result.checkType())));
        }
        issues.sort(Comparator.comparingInt((QualityIssue issue) -> issue.severity().getRank()).reversed());
        return issues;
    }

    static QualityStatus overallStatus(List<QualityCheckResult> results, List<QualityIssue> issues,
                                       int complianceScore, int accuracyScore) {
        boolean anyFailed = results.stream().anyMatch(result -> result.status() == QualityStatus.FAILED);
        if (anyFailed || issues.stream().anyMatch(QualityIssue::isCritical)) {
            return QualityStatus.FAILED;
        }
        if (complianceScore < COMPOSITE_WARNING_THRESHOLD || accuracyScore < COMPOSITE_WARNING_THRESHOLD) {
            return QualityStatus.WARNING;
        }
        return QualityStatus.PASSED;
    }
}
