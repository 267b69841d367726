package com.vidnyan.smelldsl.domain.rule;

import com.vidnyan.smelldsl.domain.error.MalformedConditionException;

/**
 * Structured form of a rule condition: {@code Smell.Feature OP TIER}.
 *
 * @param smellName      smell named before the dot
 * @param featureName    feature named after the dot; values are looked up by this name alone
 * @param operatorSymbol operator text as written
 * @param tier           threshold tier the measured value is compared with
 */
public record RuleCondition(
    String smellName,
    String featureName,
    String operatorSymbol,
    String tier
) {

    /**
     * Split a condition on whitespace. Only the first three parts are used.
     *
     * @throws MalformedConditionException if there are fewer than three parts or
     *         the first part is not exactly two dot-separated names
     */
    public static RuleCondition parse(String condition) {
        String trimmed = condition == null ? "" : condition.trim();
        String[] parts = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        if (parts.length < 3) {
            throw new MalformedConditionException("Malformed rule condition: '" + trimmed + "'");
        }

        String[] names = parts[0].split("\\.", -1);
        if (names.length != 2) {
            throw new MalformedConditionException(
                    "Expected 'Smell.Feature' but found '" + parts[0] + "'");
        }
        return new RuleCondition(names[0].trim(), names[1].trim(), parts[1], parts[2].trim());
    }

    public ComparisonOperator operator() {
        return ComparisonOperator.fromSymbol(operatorSymbol);
    }
}
