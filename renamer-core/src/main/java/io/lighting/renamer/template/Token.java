package io.lighting.renamer.template;

import java.util.Objects;

record Token(TokenType type, String text, int position) {
    Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    boolean is(TokenType expected) {
        return type == expected;
    }

    String describe() {
        return type == TokenType.EOF ? "end of template" : type + " '" + text + "'";
    }
}
