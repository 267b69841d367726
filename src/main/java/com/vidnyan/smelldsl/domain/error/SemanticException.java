package com.vidnyan.smelldsl.domain.error;

/**
 * Raised when a parsed program breaks a consistency rule: duplicate names,
 * an unknown {@code extends} target or a rule pointing at an undeclared feature.
 */
public class SemanticException extends SmellDslException {

    public SemanticException(String message) {
        super(message);
    }
}
