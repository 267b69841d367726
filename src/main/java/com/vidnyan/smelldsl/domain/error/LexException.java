package com.vidnyan.smelldsl.domain.error;

import lombok.Getter;

/**
 * Raised by the lexer on the first character that matches no token class.
 */
@Getter
public class LexException extends SmellDslException {

    private final char character;
    private final int line;
    private final int column;

    public LexException(char character, int line, int column) {
        super(String.format("Unexpected character '%s' at line %d, column %d", character, line, column));
        this.character = character;
        this.line = line;
        this.column = column;
    }
}
