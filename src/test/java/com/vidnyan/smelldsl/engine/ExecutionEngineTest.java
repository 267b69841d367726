package com.vidnyan.smelldsl.engine;

import com.vidnyan.smelldsl.domain.report.LogEntry;
import com.vidnyan.smelldsl.domain.report.RunLog;
import com.vidnyan.smelldsl.domain.rule.FeatureState;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionEngineTest {

    private final ExecutionEngine engine = new ExecutionEngine();

    private static Map<String, Double> tiers(Object... nameValuePairs) {
        Map<String, Double> tiers = new LinkedHashMap<>();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            tiers.put((String) nameValuePairs[i], ((Number) nameValuePairs[i + 1]).doubleValue());
        }
        return tiers;
    }

    private String label(double measured, Map<String, Double> tiers) {
        return engine.classify("size", measured, Optional.of(tiers)).label();
    }

    @Test
    void classify_LabelIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("HIGH", label(20, tiers("high", 10, "low", 1)));
            assertEquals("LOW", label(5, tiers("high", 10, "low", 1)));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void classify_LowerBoundIsInclusive() {
        Map<String, Double> tiers = tiers("HIGH", 10, "MEDIUM", 5, "LOW", 1);

        assertEquals("MEDIUM", label(5, tiers));
        assertEquals("HIGH", label(100, tiers));
        assertEquals("LOW", label(4.99, tiers));
        assertEquals(FeatureState.VERY_LOW_LABEL, label(0, tiers));
    }

    @Test
    void classify_DeclarationOrderDoesNotMatter() {
        Map<String, Double> tiers = tiers("low", 1, "high", 10, "medium", 5);

        assertEquals("MEDIUM", label(7, tiers));
        assertEquals("HIGH", label(10, tiers));
    }

    @Test
    void classify_EqualValuesKeepDocumentOrder() {
        assertEquals("FIRST", label(5, tiers("first", 5, "second", 5)));
        assertEquals("SECOND", label(5, tiers("second", 5, "first", 5)));
    }

    @Test
    void classify_IsMonotonic() {
        Map<String, Double> tiers = tiers("LOW", 1, "HIGH", 10, "MEDIUM", 5);
        List<String> order = List.of(FeatureState.VERY_LOW_LABEL, "LOW", "MEDIUM", "HIGH");

        int previous = -1;
        for (double value = -2; value <= 15; value += 0.5) {
            int rank = order.indexOf(label(value, tiers));
            assertTrue(rank >= previous, "tier went down at " + value);
            previous = rank;
        }
    }

    @Test
    void classify_WithoutThresholds() {
        FeatureState state = engine.classify("depth", 3, Optional.empty());

        assertEquals(FeatureState.NO_THRESHOLDS_LABEL, state.label());
        assertEquals(FeatureState.Classification.NO_THRESHOLDS, state.classification());
    }

    @Test
    void evaluateFeatureStates_CoversEveryMeasuredFeature() {
        Map<String, Double> measured = new LinkedHashMap<>();
        measured.put("size", 12.0);
        measured.put("depth", 2.0);
        Map<String, Map<String, Double>> thresholds = new LinkedHashMap<>();
        thresholds.put("size", tiers("LOW", 1, "HIGH", 10));
        thresholds.put("unused", tiers("LOW", 1));
        RunLog runLog = new RunLog();

        Map<String, FeatureState> states = engine.evaluateFeatureStates(new RuntimeData(measured, thresholds), runLog);

        assertEquals(List.of("size", "depth"), List.copyOf(states.keySet()));
        assertEquals("HIGH", states.get("size").label());
        assertEquals(FeatureState.NO_THRESHOLDS_LABEL, states.get("depth").label());
        List<String> messages = runLog.entries().stream().map(LogEntry::message).toList();
        assertTrue(messages.contains("Feature: size : HIGH"));
        assertTrue(messages.contains("Feature: depth : " + FeatureState.NO_THRESHOLDS_LABEL));
    }
}
