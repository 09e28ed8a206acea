package com.loanorigination.rules.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the rule-facing field map of a snapshot. Absent values are kept as
 * {@code null} entries so the field still counts as declared.
 */
final class SnapshotFields {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    private SnapshotFields() {
    }

    static SnapshotFields builder() {
        return new SnapshotFields();
    }

    SnapshotFields put(String name, Object value) {
        fields.put(name, value instanceof EmploymentType type ? type.getValue() : value);
        return this;
    }

    Map<String, Object> build() {
        return Collections.unmodifiableMap(fields);
    }
}
