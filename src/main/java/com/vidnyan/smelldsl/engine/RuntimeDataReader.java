package com.vidnyan.smelldsl.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.smelldsl.domain.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the measured-values and thresholds JSON documents.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuntimeDataReader {

    public static final String MEASURED_DOCUMENT = "measured.json";
    public static final String THRESHOLDS_DOCUMENT = "thresholds.json";

    private static final TypeReference<LinkedHashMap<String, Double>> MEASURED_TYPE =
            new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, Double>>> THRESHOLDS_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * @throws ValidationException if a document is absent, is not a JSON object
     *         or holds a non-numeric value
     */
    public RuntimeData read(String measuredJson, String thresholdsJson) {
        LinkedHashMap<String, Double> measured = parse(measuredJson, MEASURED_TYPE, MEASURED_DOCUMENT);
        measured.forEach((feature, value) -> requireNumber(value, MEASURED_DOCUMENT, feature));

        LinkedHashMap<String, LinkedHashMap<String, Double>> thresholds =
                parse(thresholdsJson, THRESHOLDS_TYPE, THRESHOLDS_DOCUMENT);
        thresholds.forEach((feature, tiers) -> {
            if (tiers == null) {
                throw new ValidationException(String.format(
                        "'%s' has no tier table for feature '%s'", THRESHOLDS_DOCUMENT, feature));
            }
            tiers.forEach((tier, value) -> requireNumber(value, THRESHOLDS_DOCUMENT, feature + "." + tier));
        });

        log.debug("Read {} measured values and {} threshold tables", measured.size(), thresholds.size());
        return new RuntimeData(measured, new LinkedHashMap<String, Map<String, Double>>(thresholds));
    }

    private <T> T parse(String json, TypeReference<T> type, String document) {
        if (json == null || json.isBlank()) {
            throw new ValidationException(String.format("Required document '%s' is missing", document));
        }
        try {
            T value = objectMapper.readValue(json, type);
            if (value == null) {
                throw new ValidationException(String.format("Document '%s' is empty", document));
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException(
                    String.format("Document '%s' is not valid JSON: %s", document, e.getOriginalMessage()), e);
        }
    }

    private void requireNumber(Double value, String document, String key) {
        if (value == null) {
            throw new ValidationException(String.format("'%s' has no numeric value for '%s'", document, key));
        }
    }
}
