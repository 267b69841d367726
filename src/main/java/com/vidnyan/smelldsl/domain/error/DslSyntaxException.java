package com.vidnyan.smelldsl.domain.error;

/**
 * Raised by the parser when the token stream does not follow the grammar.
 */
public class DslSyntaxException extends SmellDslException {

    public DslSyntaxException(String message) {
        super(message);
    }
}
