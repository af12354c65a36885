package io.lighting.renamer.expr;

/**
 * 四则运算求值：+ - * /、括号、一元正负号，按双精度计算。
 */
final class ArithmeticParser {
    private final String input;
    private int index;

    ArithmeticParser(String input) {
        this.input = input;
        this.index = 0;
    }

    double parse() {
        double value = parseAdditive();
        skipWhitespace();
        if (!isAtEnd()) {
            throw new IllegalArgumentException("Unexpected token at position " + index + " in expression: " + input);
        }
        return value;
    }

    private double parseAdditive() {
        double left = parseMultiplicative();
        while (true) {
            if (match('+')) {
                left = left + parseMultiplicative();
            } else if (match('-')) {
                left = left - parseMultiplicative();
            } else {
                return left;
            }
        }
    }

    private double parseMultiplicative() {
        double left = parseUnary();
        while (true) {
            if (match('*')) {
                left = left * parseUnary();
            } else if (match('/')) {
                double right = parseUnary();
                if (right == 0) {
                    throw new IllegalArgumentException("Division by zero in expression: " + input);
                }
                left = left / right;
            } else {
                return left;
            }
        }
    }

    private double parseUnary() {
        if (match('-')) {
            return -parseUnary();
        }
        if (match('+')) {
            return parseUnary();
        }
        return parsePrimary();
    }

    private double parsePrimary() {
        if (match('(')) {
            double value = parseAdditive();
            expect(')');
            return value;
        }
        skipWhitespace();
        int start = index;
        while (!isAtEnd() && (Character.isDigit(peek()) || peek() == '.')) {
            index++;
        }
        if (start == index) {
            throw new IllegalArgumentException("Expected number at position " + index + " in expression: " + input);
        }
        try {
            return Double.parseDouble(input.substring(start, index));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number at position " + start + " in expression: " + input, ex);
        }
    }

    private void expect(char expected) {
        if (!match(expected)) {
            throw new IllegalArgumentException("Expected '" + expected + "' at position " + index
                + " in expression: " + input);
        }
    }

    private boolean match(char expected) {
        skipWhitespace();
        if (!isAtEnd() && peek() == expected) {
            index++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            index++;
        }
    }

    private char peek() {
        return input.charAt(index);
    }

    private boolean isAtEnd() {
        return index >= input.length();
    }
}
