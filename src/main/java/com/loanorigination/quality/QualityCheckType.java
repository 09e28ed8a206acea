package com.loanorigination.quality;

/**
 * The standard checks with their pass/warning cut-offs and the composite
 * score they feed.
 */
public enum QualityCheckType {
    DOCUMENT_VERIFICATION("document_verification", 80, 60, ScoreGroup.ACCURACY),
    DATA_ACCURACY("data_accuracy", 85, 70, ScoreGroup.ACCURACY),
    COMPLIANCE_CHECK("compliance_check", 90, 75, ScoreGroup.COMPLIANCE),
    POLICY_ADHERENCE("policy_adherence", 85, 70, ScoreGroup.COMPLIANCE),
    RISK_VALIDATION("risk_validation", 80, 65, ScoreGroup.NONE),
    CALCULATION_VERIFICATION("calculation_verification", 95, 80, ScoreGroup.ACCURACY),
    REGULATORY_COMPLIANCE("regulatory_compliance", 90, 75, ScoreGroup.COMPLIANCE);

    public enum ScoreGroup {
        COMPLIANCE,
        ACCURACY,
        NONE
    }

    private final String value;
    private final int passedThreshold;
    private final int warningThreshold;
    private final ScoreGroup group;

    QualityCheckType(String value, int passedThreshold, int warningThreshold, ScoreGroup group) {
        this.value = value;
        this.passedThreshold = passedThreshold;
        this.warningThreshold = warningThreshold;
        this.group = group;
    }

    public String getValue() {
        return value;
    }

    public ScoreGroup getGroup() {
        return group;
    }

    public QualityStatus statusFor(int score) {
        if (score >= passedThreshold) {
            return QualityStatus.PASSED;
        }
        return score >= warningThreshold ? QualityStatus.WARNING : QualityStatus.FAILED;
    }

    public static QualityCheckType fromValue(String value) {
        for (QualityCheckType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
