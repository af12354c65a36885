package io.lighting.renamer.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class TemplateLexer {
    private final String input;
    private int index;
    private int braceDepth;

    TemplateLexer(String input) {
        this.input = Objects.requireNonNull(input, "input");
        this.index = 0;
        this.braceDepth = 0;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (!isAtEnd()) {
            tokens.add(nextToken());
        }
        tokens.add(new Token(TokenType.EOF, "", index));
        return tokens;
    }

    private Token nextToken() {
        char ch = peek();
        if (ch == '{') {
            braceDepth++;
            return single(TokenType.LEFT_BRACE);
        }
        if (ch == '}') {
            // a stray closing brace never drives the depth negative
            if (braceDepth > 0) {
                braceDepth--;
            }
            return single(TokenType.RIGHT_BRACE);
        }
        if (braceDepth == 0) {
            return readText();
        }
        return switch (ch) {
            case ':' -> single(TokenType.COLON);
            case '.' -> single(TokenType.DOT);
            case '[' -> single(TokenType.LEFT_BRACKET);
            case ']' -> single(TokenType.RIGHT_BRACKET);
            case '(' -> single(TokenType.LEFT_PAREN);
            case ')' -> single(TokenType.RIGHT_PAREN);
            case ',' -> single(TokenType.COMMA);
            case '"', '\'' -> readStringLiteral(ch);
            default -> isIdentifierStart(ch) ? readIdentifier() : readText();
        };
    }

    private Token single(TokenType type) {
        int start = index;
        index++;
        return new Token(type, input.substring(start, index), start);
    }

    private Token readText() {
        int start = index;
        while (!isAtEnd()) {
            char ch = peek();
            if (ch == '{' || ch == '}') {
                break;
            }
            if (braceDepth > 0 && (isStructural(ch) || ch == '"' || ch == '\'')) {
                break;
            }
            index++;
        }
        return new Token(TokenType.TEXT, input.substring(start, index), start);
    }

    private Token readIdentifier() {
        int start = index;
        index++;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            index++;
        }
        return new Token(TokenType.IDENTIFIER, input.substring(start, index), start);
    }

    private Token readStringLiteral(char quote) {
        int start = index;
        index++;
        StringBuilder value = new StringBuilder();
        while (!isAtEnd()) {
            char ch = input.charAt(index++);
            if (ch == quote) {
                return new Token(TokenType.STRING_LITERAL, value.toString(), start);
            }
            if (ch == '\\' && !isAtEnd()) {
                value.append(unescape(input.charAt(index++)));
            } else {
                value.append(ch);
            }
        }
        throw new TemplateSyntaxException("Unterminated string literal", start);
    }

    private static char unescape(char ch) {
        return switch (ch) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> ch;
        };
    }

    private static boolean isStructural(char ch) {
        return ch == ':' || ch == '.' || ch == '[' || ch == ']'
            || ch == '(' || ch == ')' || ch == ',';
    }

    private static boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private char peek() {
        return input.charAt(index);
    }

    private boolean isAtEnd() {
        return index >= input.length();
    }
}
