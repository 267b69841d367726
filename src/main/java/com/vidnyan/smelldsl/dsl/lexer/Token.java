package com.vidnyan.smelldsl.dsl.lexer;

/**
 * A classified piece of SmellDSL source.
 *
 * @param kind   token kind
 * @param text   source text of the token
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(
    TokenKind kind,
    String text,
    int line,
    int column
) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public String describe() {
        return String.format("%s '%s' at line %d, column %d", kind, text, line, column);
    }
}
