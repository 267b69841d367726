package com.vidnyan.smelldsl.domain.error;

/**
 * A rule condition that cannot be split into {@code Smell.Feature OP TIER}.
 * Contained by the rule checker; it only ever skips the offending rule.
 */
public class MalformedConditionException extends SmellDslException {

    public MalformedConditionException(String message) {
        super(message);
    }
}
