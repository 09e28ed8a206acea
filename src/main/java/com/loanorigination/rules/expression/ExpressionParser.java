package com.loanorigination.rules.expression;

import com.loanorigination.exception.RuleDefinitionException;
import com.loanorigination.rules.expression.Expression.ComparisonOperator;
import com.loanorigination.rules.expression.Expression.LogicalOperator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for rule condition text.
 *
 * GRAMMAR:
 * ========
 * <pre>
 * or         := and ( "||" and )*
 * and        := unary ( "&&" unary )*
 * unary      := "!" unary | comparison
 * comparison := primary ( ( "==" | "!=" | "<" | "<=" | ">" | ">=" ) primary )?
 * primary    := NUMBER | STRING | "true" | "false" | "null" | IDENTIFIER | "(" or ")"
 * </pre>
 *
 * Identifiers are field names. They are resolved against the snapshot at
 * evaluation time, never against anything else.
 */
public final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int position;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    /**
     * @throws RuleDefinitionException if the text is empty or malformed
     */
    public static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new RuleDefinitionException("Condition expression cannot be empty");
        }
        ExpressionParser parser = new ExpressionParser(source);
        Expression expression = parser.parseOr();
        if (!parser.atEnd()) {
            throw parser.error("Unexpected token '" + parser.peek().text() + "'");
        }
        return expression;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (match(TokenType.OR)) {
            left = new Expression.Logical(LogicalOperator.OR, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseUnary();
        while (match(TokenType.AND)) {
            left = new Expression.Logical(LogicalOperator.AND, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (match(TokenType.NOT)) {
            return new Expression.Not(parseUnary());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parsePrimary();
        if (!atEnd() && peek().type() == TokenType.COMPARATOR) {
            ComparisonOperator operator = ComparisonOperator.fromSymbol(advance().text());
            return new Expression.Comparison(operator, left, parsePrimary());
        }
        return left;
    }

    private Expression parsePrimary() {
        if (atEnd()) {
            throw error("Unexpected end of expression");
        }
        Token token = advance();
        return switch (token.type()) {
            case NUMBER -> new Expression.Literal(number(token.text()));
            case STRING -> new Expression.Literal(token.text());
            case IDENTIFIER -> switch (token.text()) {
                case "true" -> new Expression.Literal(Boolean.TRUE);
                case "false" -> new Expression.Literal(Boolean.FALSE);
                case "null" -> new Expression.Literal(null);
                default -> new Expression.FieldReference(token.text());
            };
            case LPAREN -> {
                Expression inner = parseOr();
                if (!match(TokenType.RPAREN)) {
                    throw error("Missing ')'");
                }
                yield inner;
            }
            default -> throw error("Unexpected token '" + token.text() + "'");
        };
    }

    private BigDecimal number(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw error("Malformed number '" + text + "'");
        }
    }

    private boolean match(TokenType type) {
        if (!atEnd() && peek().type() == type) {
            position++;
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token advance() {
        return tokens.get(position++);
    }

    private boolean atEnd() {
        return position >= tokens.size();
    }

    private RuleDefinitionException error(String message) {
        return new RuleDefinitionException(message + " in condition: " + source);
    }

    private enum TokenType {
        NUMBER, STRING, IDENTIFIER, COMPARATOR, AND, OR, NOT, LPAREN, RPAREN
    }

    private record Token(TokenType type, String text) {
    }

    private static List<Token> tokenize(String source) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                result.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                result.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (source.startsWith("&&", i)) {
                result.add(new Token(TokenType.AND, "&&"));
                i += 2;
            } else if (source.startsWith("||", i)) {
                result.add(new Token(TokenType.OR, "||"));
                i += 2;
            } else if (source.startsWith("==", i) || source.startsWith("!=", i)
                    || source.startsWith("<=", i) || source.startsWith(">=", i)) {
                result.add(new Token(TokenType.COMPARATOR, source.substring(i, i + 2)));
                i += 2;
            } else if (c == '<' || c == '>') {
                result.add(new Token(TokenType.COMPARATOR, String.valueOf(c)));
                i++;
            } else if (c == '!') {
                result.add(new Token(TokenType.NOT, "!"));
                i++;
            } else if (c == '\'' || c == '"') {
                int end = source.indexOf(c, i + 1);
                if (end < 0) {
                    throw new RuleDefinitionException("Unterminated string literal in condition: " + source);
                }
                result.add(new Token(TokenType.STRING, source.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < length && Character.isDigit(source.charAt(i + 1))
                    && startsOperand(result))) {
                int start = i++;
                while (i < length && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                result.add(new Token(TokenType.NUMBER, source.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                    i++;
                }
                result.add(new Token(TokenType.IDENTIFIER, source.substring(start, i)));
            } else {
                throw new RuleDefinitionException("Unexpected character '" + c + "' in condition: " + source);
            }
        }
        return result;
    }

    // A '-' is a sign only where an operand is expected.
    private static boolean startsOperand(List<Token> previous) {
        if (previous.isEmpty()) {
            return true;
        }
        TokenType last = previous.get(previous.size() - 1).type();
        return last != TokenType.NUMBER && last != TokenType.IDENTIFIER
                && last != TokenType.STRING && last != TokenType.RPAREN;
    }
}
