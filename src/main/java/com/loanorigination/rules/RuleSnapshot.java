package com.loanorigination.rules;

import java.util.Map;

/**
 * Immutable view of an application that rules are evaluated against.
 *
 * Implementations are typed records, one per domain. {@link #fields()}
 * exposes the declared fields by their rule-facing names so textual
 * conditions can reference them; a field that is declared but absent maps
 * to {@code null}.
 */
public interface RuleSnapshot {

    Map<String, Object> fields();
}
