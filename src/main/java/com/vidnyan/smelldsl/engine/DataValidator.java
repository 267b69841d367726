package com.vidnyan.smelldsl.engine;

import com.vidnyan.smelldsl.domain.error.ValidationException;
import com.vidnyan.smelldsl.domain.model.ParsedProgram;
import com.vidnyan.smelldsl.domain.report.RunLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Cross-checks the JSON inputs against the program: every key must be a
 * feature declared by some smell. Inputs need not cover every feature.
 */
@Slf4j
@Component
public class DataValidator {

    /**
     * @throws ValidationException if the program declares no feature at all, or
     *         a document mentions an undeclared feature
     */
    public void validate(ParsedProgram program, RuntimeData data, RunLog runLog) {
        Set<String> declaredFeatures = program.declaredFeatureNames();
        if (declaredFeatures.isEmpty()) {
            throw new ValidationException("No feature was declared in the .smelldsl source");
        }

        runLog.info("Validating consistency between the .smelldsl source and the JSON documents...");
        checkKeys(data.measured(), RuntimeDataReader.MEASURED_DOCUMENT, declaredFeatures);
        checkKeys(data.thresholds(), RuntimeDataReader.THRESHOLDS_DOCUMENT, declaredFeatures);
        runLog.success("Data consistency validated successfully.");
    }

    private void checkKeys(Map<String, ?> document, String documentName, Set<String> declaredFeatures) {
        for (String featureName : document.keySet()) {
            if (!declaredFeatures.contains(featureName)) {
                throw new ValidationException(String.format(
                        "Consistency error in '%s': feature '%s' was not declared in the .smelldsl source",
                        documentName, featureName));
            }
        }
        log.debug("All {} keys of {} are declared features", document.size(), documentName);
    }
}
