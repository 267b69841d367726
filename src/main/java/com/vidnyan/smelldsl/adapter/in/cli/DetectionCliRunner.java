package com.vidnyan.smelldsl.adapter.in.cli;

import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionRequest;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionResult;
import com.vidnyan.smelldsl.config.DetectionProperties;
import com.vidnyan.smelldsl.domain.error.EngineExecutionException;
import com.vidnyan.smelldsl.domain.rule.Alert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI Runner for a single detection run over files.
 * Runs when smelldsl.run.dsl-path is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectionCliRunner implements CommandLineRunner {

    private final DetectSmellsUseCase detectSmellsUseCase;
    private final DetectionProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        if (properties.getDslPath() == null || properties.getDslPath().isBlank()) {
            log.info("No DSL file specified. Set smelldsl.run.dsl-path to run a detection from files.");
            return;
        }

        int exitCode = 1;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                SmellDSL - Smell Detection Run                 ║");
            log.info("╚══════════════════════════════════════════════════════════════╝");
            log.info(" DSL:        {}", properties.getDslPath());
            log.info(" Thresholds: {}", properties.getThresholdsPath());
            log.info(" Measured:   {}", properties.getMeasuredPath());

            DetectionRequest request = new DetectionRequest(
                    readFile(properties.getDslPath()),
                    readFile(properties.getThresholdsPath()),
                    readFile(properties.getMeasuredPath()));
            DetectionResult result = detectSmellsUseCase.detect(request);

            printResult(result);
            exitCode = result.isSuccess() ? 0 : 1;
        } catch (EngineExecutionException e) {
            log.error("Execution failed: {}", e.getMessage());
        } finally {
            if (properties.isExitAfterRun()) {
                int code = exitCode;
                SpringApplication.exit(context, () -> code);
            }
        }
    }

    static String readFile(String path) {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EngineExecutionException("Could not read file: " + path, e);
        }
    }

    private void printResult(DetectionResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" DETECTION RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Smell types: {}", result.stats().smellTypes());
        log.info(" Smells:      {}", result.stats().smells());
        log.info(" Rules:       {} ({} skipped)", result.stats().rules(), result.stats().rulesSkipped());
        log.info(" Alerts:      {}", result.alerts().size());
        log.info("───────────────────────────────────────────────────────────────");
        result.featureStates().values().forEach(state ->
                log.info(" {} = {} -> {}", state.featureName(), Alert.format(state.measured()), state.label()));
        log.info("───────────────────────────────────────────────────────────────");

        for (String line : result.transcript().split("\n")) {
            log.info(" {}", line);
        }

        if (!result.isSuccess()) {
            log.info("");
            log.info(" ✖ Run FAILED");
        } else if (result.isClean()) {
            log.info("");
            log.info(" ✔ No smells detected.");
        }
    }
}
