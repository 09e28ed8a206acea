package com.loanorigination.rules;

import com.loanorigination.rules.expression.ExpressionCondition;

/**
 * Predicate over a snapshot. Either a native lambda or a parsed textual
 * expression (see {@link #expression(String)}).
 *
 * @param <S> snapshot type the condition reads
 */
@FunctionalInterface
public interface Condition<S extends RuleSnapshot> {

    boolean evaluate(S snapshot);

    default Condition<S> and(Condition<S> other) {
        return snapshot -> this.evaluate(snapshot) && other.evaluate(snapshot);
    }

    default Condition<S> or(Condition<S> other) {
        return snapshot -> this.evaluate(snapshot) || other.evaluate(snapshot);
    }

    default Condition<S> negate() {
        return snapshot -> !this.evaluate(snapshot);
    }

    /**
     * Parses {@code source} into a typed expression. Malformed text fails
     * here, at definition time, with a
     * {@link com.loanorigination.exception.RuleDefinitionException}.
     */
    static <S extends RuleSnapshot> Condition<S> expression(String source) {
        return ExpressionCondition.parse(source);
    }
}
