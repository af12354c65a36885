package io.lighting.renamer.template;

enum TokenType {
    TEXT,
    LEFT_BRACE,
    RIGHT_BRACE,
    COLON,
    DOT,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    IDENTIFIER,
    STRING_LITERAL,
    EOF
}
