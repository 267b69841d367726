package com.vidnyan.smelldsl.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Measured values and threshold tables of one run, both keyed by feature name.
 * Iteration follows document order. Never modified after loading.
 */
public record RuntimeData(
    Map<String, Double> measured,
    Map<String, Map<String, Double>> thresholds
) {

    public RuntimeData {
        measured = Collections.unmodifiableMap(new LinkedHashMap<>(measured));
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        thresholds.forEach((feature, tiers) ->
                copy.put(feature, Collections.unmodifiableMap(new LinkedHashMap<>(tiers))));
        thresholds = Collections.unmodifiableMap(copy);
    }

    public Optional<Double> measuredValue(String featureName) {
        return Optional.ofNullable(measured.get(featureName));
    }

    public Optional<Map<String, Double>> tiers(String featureName) {
        return Optional.ofNullable(thresholds.get(featureName));
    }

    public Optional<Double> threshold(String featureName, String tier) {
        return tiers(featureName).map(t -> t.get(tier));
    }
}
