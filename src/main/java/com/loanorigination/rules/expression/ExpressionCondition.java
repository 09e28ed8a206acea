package com.loanorigination.rules.expression;

import com.loanorigination.rules.Condition;
import com.loanorigination.rules.RuleSnapshot;
import lombok.extern.slf4j.Slf4j;

/**
 * Condition backed by a parsed expression.
 *
 * Parsing happens once, when the rule is defined. Evaluation only reads the
 * snapshot's declared fields; an unknown field, a null operand in an ordering
 * comparison or any other type mismatch evaluates to {@code false}.
 */
@Slf4j
public final class ExpressionCondition<S extends RuleSnapshot> implements Condition<S> {

    private final String source;
    private final Expression expression;

    private ExpressionCondition(String source, Expression expression) {
        this.source = source;
        this.expression = expression;
    }

    public static <S extends RuleSnapshot> ExpressionCondition<S> parse(String source) {
        return new ExpressionCondition<>(source, ExpressionParser.parse(source));
    }

    @Override
    public boolean evaluate(S snapshot) {
        try {
            return Boolean.TRUE.equals(expression.evaluate(snapshot.fields()));
        } catch (ExpressionEvaluationException | ArithmeticException | NumberFormatException e) {
            log.debug("Condition '{}' evaluated to false: {}", source, e.getMessage());
            return false;
        }
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
