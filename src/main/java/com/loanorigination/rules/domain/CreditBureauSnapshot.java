package com.loanorigination.rules.domain;

import com.loanorigination.rules.RuleSnapshot;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Bureau report summary.
 *
 * @param dpdCount       number of delinquent payments on record
 * @param maxDpdDays     worst days-past-due seen on any account
 * @param utilizationRatio revolving balance over limit, as a fraction
 */
@Builder
public record CreditBureauSnapshot(
        Integer cibilScore,
        Integer creditHistoryMonths,
        Integer dpdCount,
        Integer maxDpdDays,
        BigDecimal utilizationRatio,
        Integer recentInquiries,
        Integer writtenOffAccounts,
        Integer activeAccounts
) implements RuleSnapshot {

    @Override
    public Map<String, Object> fields() {
        return SnapshotFields.builder()
                .put("cibil_score", cibilScore)
                .put("credit_history_months", creditHistoryMonths)
                .put("dpd_count", dpdCount)
                .put("max_dpd_days", maxDpdDays)
                .put("utilization_ratio", utilizationRatio)
                .put("recent_inquiries", recentInquiries)
                .put("written_off_accounts", writtenOffAccounts)
                .put("active_accounts", activeAccounts)
                .build();
    }
}
