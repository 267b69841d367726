package com.vidnyan.smelldsl.domain.error;

/**
 * Base type for every failure raised while interpreting a SmellDSL document
 * or evaluating it against runtime data.
 *
 * Unchecked, so the individual stages stay free of throws clauses. The pipeline
 * catches this type once and turns it into the single terminal error entry.
 */
public abstract class SmellDslException extends RuntimeException {

    protected SmellDslException(String message) {
        super(message);
    }

    protected SmellDslException(String message, Throwable cause) {
        super(message, cause);
    }
}
