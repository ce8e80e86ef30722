package com.vidnyan.ust.adapter.out.parser.javascript;

/**
 * A lexical token. Line is 1-based, column 0-based.
 */
public record Token(
    TokenType type,
    String value,
    int line,
    int column
) {

    public int endColumn() {
        return column + value.length();
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
