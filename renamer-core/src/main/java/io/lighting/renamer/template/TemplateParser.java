package io.lighting.renamer.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class TemplateParser {
    private final List<Token> tokens;
    private int current;

    TemplateParser(List<Token> tokens) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.current = 0;
    }

    static List<TemplateNode> parse(String template) {
        return new TemplateParser(new TemplateLexer(template).tokenize()).parse();
    }

    List<TemplateNode> parse() {
        List<TemplateNode> nodes = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (!isAtEnd()) {
            if (check(TokenType.LEFT_BRACE)) {
                flushText(nodes, text);
                nodes.add(parseExpression());
            } else {
                text.append(advance().text());
            }
        }
        flushText(nodes, text);
        return List.copyOf(nodes);
    }

    private TemplateNode parseExpression() {
        advance();
        if (isIndexExpression()) {
            return expectClose(parseChain(parseIndexExpression()));
        }
        TemplateNode node = new VariableNode(expect(TokenType.IDENTIFIER, "Expected variable name").text());
        if (match(TokenType.COLON)) {
            node = new FormatNode(node, readFormatSpec(), null);
        }
        return expectClose(parseChain(node));
    }

    private TemplateNode expectClose(TemplateNode node) {
        expect(TokenType.RIGHT_BRACE, "Expected '}'");
        return node;
    }

    /**
     * {2*i+1} / {2i+1:00}：冒号（或右括号）前的内容以数字开头或含算术运算符，且不含 . ( [。
     */
    private boolean isIndexExpression() {
        StringBuilder content = new StringBuilder();
        for (int i = current; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.COLON) || token.is(TokenType.RIGHT_BRACE) || token.is(TokenType.EOF)) {
                break;
            }
            if (token.is(TokenType.DOT) || token.is(TokenType.LEFT_PAREN) || token.is(TokenType.LEFT_BRACKET)) {
                return false;
            }
            content.append(token.text());
        }
        String text = content.toString().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("i")) {
            return false;
        }
        if (Character.isDigit(text.charAt(0))) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '+' || ch == '-' || ch == '*' || ch == '/') {
                return true;
            }
        }
        return false;
    }

    private TemplateNode parseIndexExpression() {
        StringBuilder expression = new StringBuilder();
        while (!isAtEnd() && !check(TokenType.RIGHT_BRACE) && !check(TokenType.COLON)) {
            expression.append(advance().text());
        }
        String formatSpec = match(TokenType.COLON) ? readFormatSpec() : "";
        return new FormatNode(new VariableNode("i"), formatSpec, expression.toString().trim());
    }

    private String readFormatSpec() {
        StringBuilder spec = new StringBuilder();
        while (!isAtEnd() && !check(TokenType.RIGHT_BRACE)) {
            if (check(TokenType.LEFT_BRACKET) || startsMethodCall()) {
                break;
            }
            spec.append(advance().text());
        }
        return spec.toString();
    }

    // A dot inside a format spec (yyyy.MM.dd) only ends the spec when a known method follows it.
    private boolean startsMethodCall() {
        if (!check(TokenType.DOT)) {
            return false;
        }
        Token next = peekNext();
        return next.is(TokenType.IDENTIFIER) && StringMethod.lookup(next.text()).isPresent();
    }

    private TemplateNode parseChain(TemplateNode target) {
        TemplateNode node = target;
        while (true) {
            if (check(TokenType.DOT)) {
                node = parseMethodCall(node);
            } else if (check(TokenType.LEFT_BRACKET)) {
                node = parseSlice(node);
            } else {
                return node;
            }
        }
    }

    private TemplateNode parseMethodCall(TemplateNode target) {
        advance();
        String name = expect(TokenType.IDENTIFIER, "Expected method name after '.'").text();
        List<TemplateNode> arguments = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) {
            skipWhitespace();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    skipWhitespace();
                    arguments.add(parseArgument());
                    skipWhitespace();
                } while (match(TokenType.COMMA));
            }
            expect(TokenType.RIGHT_PAREN, "Expected ')'");
        }
        return new MethodNode(target, name, arguments);
    }

    private TemplateNode parseArgument() {
        Token token = peek();
        if (token.is(TokenType.STRING_LITERAL)) {
            advance();
            return new LiteralNode(token.text());
        }
        if (token.is(TokenType.IDENTIFIER) || token.is(TokenType.TEXT)) {
            advance();
            return new LiteralNode(literalValue(token.text().trim()));
        }
        throw new TemplateSyntaxException("Unexpected " + token.describe() + " in method arguments", token.position());
    }

    private TemplateNode parseSlice(TemplateNode target) {
        advance();
        skipWhitespace();
        LiteralNode start = parseSliceBound("start");
        LiteralNode end = null;
        skipWhitespace();
        if (match(TokenType.COLON)) {
            skipWhitespace();
            end = parseSliceBound("end");
            skipWhitespace();
        }
        expect(TokenType.RIGHT_BRACKET, "Expected ']'");
        return new SliceNode(target, start, end);
    }

    private LiteralNode parseSliceBound(String which) {
        Token token = peek();
        if (!token.is(TokenType.TEXT) && !token.is(TokenType.IDENTIFIER) && !token.is(TokenType.STRING_LITERAL)) {
            return null;
        }
        advance();
        try {
            return new LiteralNode(Integer.parseInt(token.text().trim()));
        } catch (NumberFormatException ex) {
            throw new TemplateSyntaxException("Invalid slice " + which + " index '" + token.text() + "'",
                token.position());
        }
    }

    private static Object literalValue(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            return text;
        }
    }

    private void skipWhitespace() {
        while (check(TokenType.TEXT) && peek().text().isBlank()) {
            advance();
        }
    }

    private static void flushText(List<TemplateNode> nodes, StringBuilder text) {
        if (text.length() > 0) {
            nodes.add(new TextNode(text.toString()));
            text.setLength(0);
        }
    }

    private Token expect(TokenType type, String message) {
        Token token = peek();
        if (!token.is(type)) {
            throw new TemplateSyntaxException(message + ", found " + token.describe(), token.position());
        }
        return advance();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }

    private boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }
}
