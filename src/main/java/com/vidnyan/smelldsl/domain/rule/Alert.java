package com.vidnyan.smelldsl.domain.rule;

import java.math.BigDecimal;

/**
 * A triggered rule.
 * Immutable value object.
 */
public record Alert(
    String ruleName,
    String featureName,
    double measured,
    String operator,
    String tier,
    double threshold,
    String action
) {

    public String message() {
        return String.format("[ALERT] Rule '%s' triggered: %s (%s) %s %s (%s). Suggested action: %s",
                ruleName, featureName, format(measured), operator, tier, format(threshold), action);
    }

    /**
     * Whole numbers print without a fractional part.
     */
    public static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
