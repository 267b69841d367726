package com.vidnyan.smelldsl.engine;

import com.vidnyan.smelldsl.domain.report.RunLog;
import com.vidnyan.smelldsl.domain.rule.FeatureState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies each measured feature value into one of its threshold tiers.
 *
 * Tiers are ordered by value, highest first, keeping document order among equal
 * values. The first tier whose value is at most the measured value wins, so each
 * tier covers {@code [value, next higher value)}. Missing data is a state, not an error.
 */
@Component
public class ExecutionEngine {

    /**
     * State of every feature present in the measured data, in document order.
     */
    public Map<String, FeatureState> evaluateFeatureStates(RuntimeData data, RunLog runLog) {
        Map<String, FeatureState> states = new LinkedHashMap<>();

        runLog.info("Evaluating feature states...");
        data.measured().forEach((featureName, measured) -> {
            FeatureState state = classify(featureName, measured, data.tiers(featureName));
            states.put(featureName, state);
            runLog.info(String.format("Feature: %s : %s", featureName, state.label()));
        });
        return states;
    }

    public FeatureState classify(String featureName, double measured, Optional<Map<String, Double>> tiers) {
        if (tiers.isEmpty()) {
            return FeatureState.noThresholds(featureName, measured);
        }

        // List.sort is stable, equal values keep document order
        List<Map.Entry<String, Double>> ordered = new ArrayList<>(tiers.get().entrySet());
        ordered.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));

        for (Map.Entry<String, Double> tier : ordered) {
            if (tier.getValue() <= measured) {
                return FeatureState.tier(featureName, measured, tier.getKey());
            }
        }
        return FeatureState.belowAllTiers(featureName, measured);
    }
}
