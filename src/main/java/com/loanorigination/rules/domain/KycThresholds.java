package com.loanorigination.rules.domain;

public record KycThresholds(int minAge, int maxAge) {

    public KycThresholds {
        if (minAge > maxAge) {
            throw new IllegalArgumentException("minAge must not exceed maxAge");
        }
    }

    public static KycThresholds defaults() {
        return new KycThresholds(21, 65);
    }
}
