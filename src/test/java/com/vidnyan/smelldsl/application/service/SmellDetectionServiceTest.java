package com.vidnyan.smelldsl.application.service;

import com.vidnyan.smelldsl.Fixtures;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionRequest;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionResult;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.Status;
import com.vidnyan.smelldsl.config.SmellDslConfiguration;
import com.vidnyan.smelldsl.domain.report.LogEntry;
import com.vidnyan.smelldsl.domain.report.LogLevel;
import com.vidnyan.smelldsl.domain.rule.Alert;
import com.vidnyan.smelldsl.domain.rule.FeatureState;
import com.vidnyan.smelldsl.dsl.SmellDslInterpreter;
import com.vidnyan.smelldsl.dsl.lexer.Lexer;
import com.vidnyan.smelldsl.dsl.semantic.SemanticAnalyzer;
import com.vidnyan.smelldsl.engine.DataValidator;
import com.vidnyan.smelldsl.engine.ExecutionEngine;
import com.vidnyan.smelldsl.engine.RuleChecker;
import com.vidnyan.smelldsl.engine.RuntimeDataReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmellDetectionServiceTest {

    private final SmellDetectionService service = new SmellDetectionService(
            new SmellDslInterpreter(new Lexer(), new SemanticAnalyzer()),
            new RuntimeDataReader(new SmellDslConfiguration().objectMapper()),
            new DataValidator(),
            new ExecutionEngine(),
            new RuleChecker());

    private static DetectionRequest fixtureRequest() {
        return new DetectionRequest(
                Fixtures.read("bloaters.smelldsl"),
                Fixtures.read("thresholds.json"),
                Fixtures.read("measured.json"));
    }

    private static List<String> messages(DetectionResult result) {
        return result.entries().stream().map(LogEntry::message).toList();
    }

    @Test
    void detect_FullPipeline() {
        DetectionResult result = service.detect(fixtureRequest());

        assertEquals(Status.SUCCESS, result.status());
        assertEquals(2, result.stats().smellTypes());
        assertEquals(2, result.stats().smells());
        assertEquals(3, result.stats().rules());

        assertEquals("HIGH", result.featureStates().get("size").label());
        assertEquals("HIGH", result.featureStates().get("complexity").label());
        assertEquals(FeatureState.VERY_LOW_LABEL, result.featureStates().get("foreignCalls").label());

        assertEquals(List.of("LongMethodRule", "ComplexMethodRule"),
                result.alerts().stream().map(Alert::ruleName).toList());
        assertEquals("Extract smaller methods", result.alerts().get(0).action());
        assertEquals(">=", result.alerts().get(1).operator());

        assertTrue(messages(result).contains("2 smells detected."));
        assertEquals("Whole process completed without errors.", messages(result).get(messages(result).size() - 1));
        assertEquals(0, result.entries().stream().filter(e -> e.level() == LogLevel.ERROR).count());
    }

    @Test
    void detect_IsIdempotent() {
        DetectionResult first = service.detect(fixtureRequest());
        DetectionResult second = service.detect(fixtureRequest());

        assertEquals(first.alerts(), second.alerts());
        assertEquals(first.featureStates(), second.featureStates());
        assertEquals(messages(first), messages(second));
    }

    @Test
    void detect_StageEntriesAreOrdered() {
        List<String> messages = messages(service.detect(fixtureRequest()));

        int stage1 = messages.indexOf("Stage 1: interpreting the .smelldsl source...");
        int stage2 = messages.indexOf("Stage 2: validating JSON data consistency...");
        int stage3 = messages.indexOf("Stage 3: running the execution engine...");
        int stage4 = messages.indexOf("Stage 4: checking rules...");
        assertTrue(stage1 >= 0 && stage1 < stage2 && stage2 < stage3 && stage3 < stage4, messages.toString());
    }

    @Test
    void detect_TimestampsAreNonDecreasing() {
        List<LogEntry> entries = service.detect(fixtureRequest()).entries();

        for (int i = 1; i < entries.size(); i++) {
            assertFalse(entries.get(i).timestamp().isBefore(entries.get(i - 1).timestamp()));
        }
    }

    @Test
    void detect_UndeclaredFeatureAbortsBeforeEvaluation() {
        DetectionRequest request = new DetectionRequest(
                Fixtures.read("bloaters.smelldsl"),
                Fixtures.read("thresholds.json"),
                "{\"size\": 1, \"depth\": 4}");

        DetectionResult result = service.detect(request);

        assertEquals(Status.FAILED, result.status());
        assertTrue(result.featureStates().isEmpty());
        assertTrue(result.alerts().isEmpty());
        assertFalse(messages(result).contains("Stage 3: running the execution engine..."));
        LogEntry last = result.entries().get(result.entries().size() - 1);
        assertEquals(LogLevel.ERROR, last.level());
        assertTrue(last.message().contains("'depth'"), last.message());
    }

    @Test
    void detect_LexErrorIsTheOnlyFailure() {
        DetectionResult result = service.detect(new DetectionRequest("smelltype A $", "{}", "{}"));

        assertEquals(Status.FAILED, result.status());
        assertEquals(1, result.entries().stream().filter(e -> e.level() == LogLevel.ERROR).count());
        assertEquals(0, result.stats().rules());
        assertTrue(result.transcript().endsWith("[✖] Execution failed: Unexpected character '$' at line 1, column 13"),
                result.transcript());
    }

    @Test
    void detect_SemanticErrorFails() {
        DetectionResult result = service.detect(
                new DetectionRequest("smell S extends Nothing { }", "{}", "{}"));

        assertEquals(Status.FAILED, result.status());
        assertTrue(result.transcript().contains("Nothing"));
    }

    @Test
    void detect_MissingDataWarnsButOtherRulesRun() {
        DetectionRequest request = new DetectionRequest(
                Fixtures.read("bloaters.smelldsl"),
                Fixtures.read("thresholds.json"),
                "{\"size\": 100}");

        DetectionResult result = service.detect(request);

        assertEquals(Status.SUCCESS, result.status());
        assertEquals(List.of("LongMethodRule"), result.alerts().stream().map(Alert::ruleName).toList());
        assertEquals(2, result.stats().rulesSkipped());
    }

    @Test
    void detect_NoTriggersIsClean() {
        DetectionRequest request = new DetectionRequest(
                Fixtures.read("bloaters.smelldsl"),
                Fixtures.read("thresholds.json"),
                "{\"size\": 1, \"complexity\": 1, \"foreignCalls\": 1}");

        DetectionResult result = service.detect(request);

        assertTrue(result.isClean());
        assertTrue(messages(result).contains("No rule was triggered. The code is clean."));
    }
}
