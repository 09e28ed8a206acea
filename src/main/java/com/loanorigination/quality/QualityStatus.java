package com.loanorigination.quality;

public enum QualityStatus {
    PASSED,
    WARNING,
    FAILED
}
