package com.puzzlesolver.core.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive descent parser for infix expressions such as {@code (a * (b + 6 + 6)) + 5}.
 * Supports integer literals, identifiers, {@code + - * /} with the usual precedence and
 * parentheses. A run of the same operator at one precedence level becomes a single
 * {@link Operation}, so {@code a + b + c} parses to one node with three operands.
 */
public final class ExpressionParser {

    private final String text;
    private int position;

    private ExpressionParser(String text) {
        this.text = text;
    }

    /**
     * Parses the given text into an {@link Expression}.
     *
     * @throws IllegalArgumentException if the text is not a well-formed expression
     */
    public static Expression parse(String text) {
        Objects.requireNonNull(text, "text");
        ExpressionParser parser = new ExpressionParser(text);
        Expression expression = parser.parseSum();
        parser.skipWhitespace();
        if (parser.position < text.length()) {
            throw parser.error("Unexpected '" + text.charAt(parser.position) + "'");
        }
        return expression;
    }

    private Expression parseSum() {
        return parseLevel(true);
    }

    private Expression parseProduct() {
        return parseLevel(false);
    }

    private Expression parseLevel(boolean additive) {
        Expression first = additive ? parseProduct() : parseFactor();
        List<Expression> operands = new ArrayList<>();
        operands.add(first);
        Operator current = null;
        while (true) {
            skipWhitespace();
            if (position >= text.length()) {
                break;
            }
            char c = text.charAt(position);
            boolean matches = additive ? (c == '+' || c == '-') : (c == '*' || c == '/');
            if (!matches) {
                break;
            }
            Operator operator = Operator.fromSymbol(c);
            position++;
            Expression next = additive ? parseProduct() : parseFactor();
            if (current != null && operator != current) {
                operands = fold(current, operands);
            }
            current = operator;
            operands.add(next);
        }
        return current == null ? first : new Operation(current, operands);
    }

    private static List<Expression> fold(Operator operator, List<Expression> operands) {
        List<Expression> folded = new ArrayList<>();
        folded.add(new Operation(operator, operands));
        return folded;
    }

    private Expression parseFactor() {
        skipWhitespace();
        if (position >= text.length()) {
            throw error("Unexpected end of expression");
        }
        char c = text.charAt(position);
        if (c == '(') {
            position++;
            Expression inner = parseSum();
            skipWhitespace();
            if (position >= text.length() || text.charAt(position) != ')') {
                throw error("Expected ')'");
            }
            position++;
            return inner;
        }
        if (Character.isDigit(c)) {
            int start = position;
            while (position < text.length() && Character.isDigit(text.charAt(position))) {
                position++;
            }
            try {
                return new Literal(Integer.parseInt(text.substring(start, position)));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Literal out of range at position " + start, ex);
            }
        }
        if (Character.isLetter(c) || c == '_') {
            int start = position;
            while (position < text.length()
                    && (Character.isLetterOrDigit(text.charAt(position)) || text.charAt(position) == '_')) {
                position++;
            }
            return new Variable(text.substring(start, position));
        }
        throw error("Unexpected '" + c + "'");
    }

    private void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + position + " in \"" + text + "\"");
    }
}
