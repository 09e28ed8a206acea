package com.loanorigination.rules.domain;

import java.util.Locale;

public enum EmploymentType {
    SALARIED("salaried"),
    SELF_EMPLOYED("self_employed"),
    PROFESSIONAL("professional"),
    OTHER("other");

    private final String value;

    EmploymentType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EmploymentType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (EmploymentType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
