package com.loanorigination.model;

public enum ProcessingMethod {
    AUTOMATED,
    MANUAL
}
