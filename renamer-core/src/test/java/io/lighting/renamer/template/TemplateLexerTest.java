package io.lighting.renamer.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class TemplateLexerTest {

    @Test
    void treatsEverythingOutsideBracesAsText() {
        List<Token> tokens = new TemplateLexer("a.b:c,d(e)").tokenize();

        assertEquals(List.of(
            new Token(TokenType.TEXT, "a.b:c,d(e)", 0),
            new Token(TokenType.EOF, "", 10)
        ), tokens);
    }

    @Test
    void tokenizesVariablesAndSeparators() {
        List<TokenType> types = types("{name}.{ext}");

        assertEquals(List.of(
            TokenType.LEFT_BRACE, TokenType.IDENTIFIER, TokenType.RIGHT_BRACE,
            TokenType.TEXT,
            TokenType.LEFT_BRACE, TokenType.IDENTIFIER, TokenType.RIGHT_BRACE,
            TokenType.EOF
        ), types);
    }

    @Test
    void tokenizesMethodChainsAndSlices() {
        List<TokenType> types = types("{name.sub(1,3)[0:1]}");

        assertEquals(List.of(
            TokenType.LEFT_BRACE, TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER,
            TokenType.LEFT_PAREN, TokenType.TEXT, TokenType.COMMA, TokenType.TEXT, TokenType.RIGHT_PAREN,
            TokenType.LEFT_BRACKET, TokenType.TEXT, TokenType.COLON, TokenType.TEXT, TokenType.RIGHT_BRACKET,
            TokenType.RIGHT_BRACE, TokenType.EOF
        ), types);
    }

    @Test
    void readsArithmeticAsSingleTextRun() {
        List<Token> tokens = new TemplateLexer("{2i+1:000}").tokenize();

        assertEquals(new Token(TokenType.TEXT, "2i+1", 1), tokens.get(1));
        assertEquals(new Token(TokenType.TEXT, "000", 6), tokens.get(3));
    }

    @Test
    void unescapesStringLiterals() {
        List<Token> tokens = new TemplateLexer("{x(\"a\\\"b\", 'c\\'d', 'e\\tf')}").tokenize();

        assertEquals(new Token(TokenType.STRING_LITERAL, "a\"b", 3), tokens.get(3));
        assertEquals("c'd", tokens.get(6).text());
        assertEquals("e\tf", tokens.get(9).text());
    }

    @Test
    void strayClosingBraceDoesNotOpenExpression() {
        List<TokenType> types = types("}a.b{c}");

        assertEquals(List.of(
            TokenType.RIGHT_BRACE, TokenType.TEXT, TokenType.LEFT_BRACE, TokenType.IDENTIFIER,
            TokenType.RIGHT_BRACE, TokenType.EOF
        ), types);
    }

    @Test
    void rejectsUnterminatedStringLiteral() {
        TemplateSyntaxException ex = assertThrows(TemplateSyntaxException.class,
            () -> new TemplateLexer("{name.replace('a").tokenize());

        assertEquals(14, ex.position());
    }

    private static List<TokenType> types(String input) {
        return new TemplateLexer(input).tokenize().stream().map(Token::type).toList();
    }
}
