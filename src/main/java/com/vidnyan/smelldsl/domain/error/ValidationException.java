package com.vidnyan.smelldsl.domain.error;

/**
 * Raised when the JSON inputs are absent, malformed or mention a feature the
 * program never declared.
 */
public class ValidationException extends SmellDslException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
