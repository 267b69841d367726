package com.vidnyan.smelldsl.domain.error;

/**
 * Raised when the data the execution engine should evaluate cannot be loaded.
 */
public class EngineExecutionException extends SmellDslException {

    public EngineExecutionException(String message) {
        super(message);
    }

    public EngineExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
