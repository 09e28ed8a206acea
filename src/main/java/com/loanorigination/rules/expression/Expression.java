package com.loanorigination.rules.expression;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a parsed condition expression.
 *
 * Nodes are immutable and evaluate against a snapshot's field map. Any
 * unknown field or type mismatch raises {@link ExpressionEvaluationException};
 * {@link ExpressionCondition} turns that into {@code false}.
 */
public interface Expression {

    Object evaluate(Map<String, Object> fields);

    record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> fields) {
            return value;
        }
    }

    record FieldReference(String name) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> fields) {
            if (!fields.containsKey(name)) {
                throw new ExpressionEvaluationException("Unknown field: " + name);
            }
            return fields.get(name);
        }
    }

    record Not(Expression operand) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> fields) {
            return !asBoolean(operand.evaluate(fields));
        }
    }

    record Logical(LogicalOperator operator, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> fields) {
            boolean lhs = asBoolean(left.evaluate(fields));
            return switch (operator) {
                case AND -> lhs && asBoolean(right.evaluate(fields));
                case OR -> lhs || asBoolean(right.evaluate(fields));
            };
        }
    }

    record Comparison(ComparisonOperator operator, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> fields) {
            Object lhs = left.evaluate(fields);
            Object rhs = right.evaluate(fields);
            return switch (operator) {
                case EQ -> valuesEqual(lhs, rhs);
                case NE -> !valuesEqual(lhs, rhs);
                default -> operator.test(compare(lhs, rhs));
            };
        }
    }

    enum LogicalOperator {
        AND,
        OR
    }

    enum ComparisonOperator {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        boolean test(int comparison) {
            return switch (this) {
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
            };
        }

        static ComparisonOperator fromSymbol(String symbol) {
            for (ComparisonOperator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }
    }

    private static boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new ExpressionEvaluationException("Expected boolean but got " + describe(value));
    }

    private static boolean valuesEqual(Object lhs, Object rhs) {
        if (lhs instanceof Number && rhs instanceof Number) {
            return toDecimal(lhs).compareTo(toDecimal(rhs)) == 0;
        }
        if (lhs == null || rhs == null) {
            return lhs == rhs;
        }
        if (!lhs.getClass().equals(rhs.getClass())) {
            throw new ExpressionEvaluationException(
                    "Cannot compare " + describe(lhs) + " with " + describe(rhs));
        }
        return Objects.equals(lhs, rhs);
    }

    private static int compare(Object lhs, Object rhs) {
        if (lhs instanceof Number && rhs instanceof Number) {
            return toDecimal(lhs).compareTo(toDecimal(rhs));
        }
        if (lhs instanceof String l && rhs instanceof String r) {
            return l.compareTo(r);
        }
        throw new ExpressionEvaluationException(
                "Cannot order " + describe(lhs) + " against " + describe(rhs));
    }

    private static BigDecimal toDecimal(Object number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(((Number) number).doubleValue());
        }
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(((Number) number).longValue());
        }
        return new BigDecimal(number.toString());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
