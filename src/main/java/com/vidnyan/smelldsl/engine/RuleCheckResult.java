package com.vidnyan.smelldsl.engine;

import com.vidnyan.smelldsl.domain.rule.Alert;

import java.util.List;

/**
 * Outcome of checking every rule of a program.
 *
 * @param alerts       triggered rules in declaration order
 * @param skippedRules rules that could not be evaluated, with the reason
 */
public record RuleCheckResult(
    List<Alert> alerts,
    List<SkippedRule> skippedRules
) {

    public RuleCheckResult {
        alerts = List.copyOf(alerts);
        skippedRules = List.copyOf(skippedRules);
    }

    public boolean isClean() {
        return alerts.isEmpty();
    }

    public record SkippedRule(String ruleName, String reason) {}
}
