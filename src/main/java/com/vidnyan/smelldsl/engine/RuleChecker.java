package com.vidnyan.smelldsl.engine;

import com.vidnyan.smelldsl.domain.model.ParsedProgram;
import com.vidnyan.smelldsl.domain.model.Rule;
import com.vidnyan.smelldsl.domain.report.RunLog;
import com.vidnyan.smelldsl.domain.rule.Alert;
import com.vidnyan.smelldsl.domain.rule.RuleCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates every rule of a program against the runtime data.
 *
 * Rules are independent and run in declaration order. The measured value is
 * looked up by feature name only; the smell part of the condition is not used
 * here. A rule with missing data or a malformed condition is skipped with a
 * warning and the remaining rules still run.
 */
@Slf4j
@Component
public class RuleChecker {

    public RuleCheckResult checkAllRules(ParsedProgram program, RuntimeData data, RunLog runLog) {
        runLog.info("Checking smell detection rules...");

        List<Alert> alerts = new ArrayList<>();
        List<RuleCheckResult.SkippedRule> skipped = new ArrayList<>();

        for (Rule rule : program.rules()) {
            try {
                RuleCondition condition = RuleCondition.parse(rule.condition());
                String featureName = condition.featureName();

                Optional<Double> measured = data.measuredValue(featureName);
                Optional<Double> threshold = data.threshold(featureName, condition.tier());
                if (measured.isEmpty() || threshold.isEmpty()) {
                    String reason = String.format(
                            "Rule '%s': missing data or thresholds for '%s'.", rule.name(), featureName);
                    runLog.warning(reason);
                    skipped.add(new RuleCheckResult.SkippedRule(rule.name(), reason));
                    continue;
                }

                if (condition.operator().test(measured.get(), threshold.get())) {
                    Alert alert = new Alert(rule.name(), featureName, measured.get(),
                            condition.operatorSymbol(), condition.tier(), threshold.get(), rule.action());
                    alerts.add(alert);
                    runLog.warning(alert.message());
                } else {
                    log.debug("Rule '{}' not triggered", rule.name());
                }
            } catch (RuntimeException e) {
                String reason = String.format("Failed to process rule '%s': %s", rule.name(), e.getMessage());
                runLog.warning(reason);
                skipped.add(new RuleCheckResult.SkippedRule(rule.name(), reason));
            }
        }

        if (alerts.isEmpty()) {
            runLog.success("No rule was triggered. The code is clean.");
        } else {
            runLog.info(String.format("%d smells detected.", alerts.size()));
        }
        return new RuleCheckResult(alerts, skipped);
    }
}
