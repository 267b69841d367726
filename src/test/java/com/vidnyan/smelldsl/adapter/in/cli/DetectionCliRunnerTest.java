package com.vidnyan.smelldsl.adapter.in.cli;

import com.vidnyan.smelldsl.Fixtures;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionRequest;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionResult;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.ProgramStats;
import com.vidnyan.smelldsl.config.DetectionProperties;
import com.vidnyan.smelldsl.domain.error.EngineExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DetectionCliRunnerTest {

    @TempDir
    Path tempDir;

    private final List<DetectionRequest> received = new ArrayList<>();

    private final DetectSmellsUseCase recordingUseCase = request -> {
        received.add(request);
        return new DetectionResult(DetectSmellsUseCase.Status.SUCCESS, List.of(), "", Map.of(), List.of(),
                ProgramStats.empty());
    };

    private DetectionProperties properties(Path dsl, Path thresholds, Path measured) {
        DetectionProperties properties = new DetectionProperties();
        properties.setDslPath(dsl.toString());
        properties.setThresholdsPath(thresholds.toString());
        properties.setMeasuredPath(measured.toString());
        properties.setExitAfterRun(false);
        return properties;
    }

    @Test
    void run_ShouldReadTheThreeFiles() throws IOException {
        Path dsl = Files.writeString(tempDir.resolve("catalogue.smelldsl"), Fixtures.read("bloaters.smelldsl"));
        Path thresholds = Files.writeString(tempDir.resolve("thresholds.json"), Fixtures.read("thresholds.json"));
        Path measured = Files.writeString(tempDir.resolve("measured.json"), Fixtures.read("measured.json"));

        new DetectionCliRunner(recordingUseCase, properties(dsl, thresholds, measured), null).run();

        assertEquals(1, received.size());
        assertEquals(Fixtures.read("bloaters.smelldsl"), received.get(0).smellDsl());
        assertEquals(Fixtures.read("thresholds.json"), received.get(0).thresholdsJson());
        assertEquals(Fixtures.read("measured.json"), received.get(0).measuredJson());
    }

    @Test
    void run_MissingFile_ShouldNotReachThePipeline() throws IOException {
        Path dsl = Files.writeString(tempDir.resolve("catalogue.smelldsl"), "smelltype A");

        new DetectionCliRunner(recordingUseCase,
                properties(dsl, tempDir.resolve("nope.json"), tempDir.resolve("nope2.json")), null).run();

        assertTrue(received.isEmpty());
    }

    @Test
    void run_WithoutDslPath_ShouldSkip() {
        new DetectionCliRunner(recordingUseCase, new DetectionProperties(), null).run();

        assertTrue(received.isEmpty());
    }

    @Test
    void readFile_Missing() {
        EngineExecutionException error = assertThrows(EngineExecutionException.class,
                () -> DetectionCliRunner.readFile(tempDir.resolve("absent.json").toString()));

        assertTrue(error.getMessage().contains("absent.json"));
    }
}
