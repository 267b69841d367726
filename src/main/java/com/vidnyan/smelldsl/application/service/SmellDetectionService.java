package com.vidnyan.smelldsl.application.service;

import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase;
import com.vidnyan.smelldsl.domain.error.SmellDslException;
import com.vidnyan.smelldsl.domain.model.ParsedProgram;
import com.vidnyan.smelldsl.domain.report.RunLog;
import com.vidnyan.smelldsl.domain.report.Transcript;
import com.vidnyan.smelldsl.domain.rule.FeatureState;
import com.vidnyan.smelldsl.dsl.SmellDslInterpreter;
import com.vidnyan.smelldsl.engine.DataValidator;
import com.vidnyan.smelldsl.engine.ExecutionEngine;
import com.vidnyan.smelldsl.engine.RuleCheckResult;
import com.vidnyan.smelldsl.engine.RuleChecker;
import com.vidnyan.smelldsl.engine.RuntimeData;
import com.vidnyan.smelldsl.engine.RuntimeDataReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates the detection pipeline.
 *
 * Flow:
 * 1. Interpret the DSL (lex, parse, semantic checks)
 * 2. Read the JSON documents and check their keys against the program
 * 3. Classify every measured feature
 * 4. Evaluate the rules
 *
 * Every run gets its own {@link RunLog}. The first fatal error ends the run with
 * a single error entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SmellDetectionService implements DetectSmellsUseCase {

    private final SmellDslInterpreter interpreter;
    private final RuntimeDataReader runtimeDataReader;
    private final DataValidator dataValidator;
    private final ExecutionEngine executionEngine;
    private final RuleChecker ruleChecker;

    @Override
    public DetectionResult detect(DetectionRequest request) {
        return detect(request, new RunLog());
    }

    DetectionResult detect(DetectionRequest request, RunLog runLog) {
        Instant startTime = Instant.now();

        ParsedProgram program = null;
        Map<String, FeatureState> featureStates = Map.of();
        RuleCheckResult ruleResult = new RuleCheckResult(List.of(), List.of());
        Status status = Status.SUCCESS;

        try {
            runLog.info("Stage 1: interpreting the .smelldsl source...");
            program = interpreter.run(request.smellDsl(), runLog);
            runLog.success("Stage 1 completed successfully.");

            runLog.info("Stage 2: validating JSON data consistency...");
            RuntimeData data = runtimeDataReader.read(request.measuredJson(), request.thresholdsJson());
            dataValidator.validate(program, data, runLog);
            runLog.success("Stage 2 completed successfully.");

            runLog.info("Stage 3: running the execution engine...");
            featureStates = executionEngine.evaluateFeatureStates(data, runLog);
            runLog.success("Stage 3 completed successfully.");

            runLog.info("Stage 4: checking rules...");
            ruleResult = ruleChecker.checkAllRules(program, data, runLog);
            runLog.success("Stage 4 completed successfully.");

            runLog.success("Whole process completed without errors.");
        } catch (SmellDslException e) {
            status = Status.FAILED;
            runLog.error("Execution failed: " + e.getMessage());
        }

        log.info("Detection {} in {}ms: {} alerts",
                status, Duration.between(startTime, Instant.now()).toMillis(), ruleResult.alerts().size());

        return new DetectionResult(
                status,
                runLog.entries(),
                Transcript.unified(runLog.entries()),
                featureStates,
                ruleResult.alerts(),
                stats(program, ruleResult));
    }

    private ProgramStats stats(ParsedProgram program, RuleCheckResult ruleResult) {
        if (program == null) {
            return ProgramStats.empty();
        }
        return new ProgramStats(
                program.smellTypes().size(),
                program.smells().size(),
                program.rules().size(),
                ruleResult.skippedRules().size());
    }
}
