package com.vidnyan.smelldsl.application.port.in;

import com.vidnyan.smelldsl.domain.report.LogEntry;
import com.vidnyan.smelldsl.domain.rule.Alert;
import com.vidnyan.smelldsl.domain.rule.FeatureState;

import java.util.List;
import java.util.Map;

/**
 * Primary use case: interpret a SmellDSL document and evaluate its rules
 * against measured values and threshold tables.
 */
public interface DetectSmellsUseCase {

    /**
     * Run the whole pipeline. Failures are reported inside the result, never thrown.
     */
    DetectionResult detect(DetectionRequest request);

    /**
     * Pipeline inputs, as raw text.
     */
    record DetectionRequest(
        String smellDsl,
        String thresholdsJson,
        String measuredJson
    ) {}

    enum Status {
        SUCCESS,
        FAILED
    }

    /**
     * Pipeline outcome.
     *
     * @param status        FAILED when a fatal error aborted the run
     * @param entries       ordered progress entries
     * @param transcript    entries joined into one text block
     * @param featureStates tier of every measured feature, empty if the run stopped earlier
     * @param alerts        triggered rules, empty if the run stopped earlier
     * @param stats         size of the interpreted program
     */
    record DetectionResult(
        Status status,
        List<LogEntry> entries,
        String transcript,
        Map<String, FeatureState> featureStates,
        List<Alert> alerts,
        ProgramStats stats
    ) {
        public boolean isSuccess() {
            return status == Status.SUCCESS;
        }

        public boolean isClean() {
            return isSuccess() && alerts.isEmpty();
        }
    }

    /**
     * Declaration counts of the interpreted program.
     */
    record ProgramStats(
        int smellTypes,
        int smells,
        int rules,
        int rulesSkipped
    ) {
        public static ProgramStats empty() {
            return new ProgramStats(0, 0, 0, 0);
        }
    }
}
