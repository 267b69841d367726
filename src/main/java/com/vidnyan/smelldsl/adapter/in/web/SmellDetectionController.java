package com.vidnyan.smelldsl.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionRequest;
import com.vidnyan.smelldsl.application.port.in.DetectSmellsUseCase.DetectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for running the detection pipeline on posted content.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SmellDetectionController {

    private final DetectSmellsUseCase detectSmellsUseCase;

    @GetMapping("/")
    public String home() {
        return "Welcome to the smell detection API!";
    }

    @PostMapping("/api/process")
    public ResponseEntity<?> process(@RequestBody ProcessRequest request) {
        if (isBlank(request.smelldsl()) || isBlank(request.limites()) || isBlank(request.dados())) {
            log.warn("Rejected detection request with missing content");
            return ResponseEntity.badRequest().body(Map.of("error", "Missing content."));
        }

        log.info("Received detection request ({} characters of DSL)", request.smelldsl().length());
        DetectionResult result = detectSmellsUseCase.detect(
                new DetectionRequest(request.smelldsl(), request.limites(), request.dados()));
        return ResponseEntity.ok(result);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Request body. The two JSON documents are sent as strings.
     */
    public record ProcessRequest(
        String smelldsl,
        @JsonAlias("thresholds") String limites,
        @JsonAlias("measured") String dados
    ) {}
}
