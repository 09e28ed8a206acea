package com.loanorigination.quality;

public enum IssueType {
    MISSING_DOCUMENT,
    INCOMPLETE_DOCUMENT,
    OUTDATED_DOCUMENT,
    INVALID_DATA,
    COMPLIANCE_VIOLATION,
    POLICY_VIOLATION,
    RISK_CONCERN,
    CALCULATION_ERROR,
    REGULATORY_GAP
}
