package com.vidnyan.smelldsl.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A declared code smell.
 * Immutable value object; the parser assembles it through {@link Builder}.
 */
public record Smell(
    String name,
    String extendsType,
    List<Feature> features,
    String symptom,
    String treatment
) {

    public Smell {
        features = List.copyOf(features);
    }

    public Optional<String> parent() {
        return Optional.ofNullable(extendsType);
    }

    public boolean declaresFeature(String featureName) {
        return features.stream().anyMatch(f -> f.name().equals(featureName));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String extendsType;
        private final List<Feature> features = new ArrayList<>();
        private String symptom;
        private String treatment;

        private Builder(String name) {
            this.name = name;
        }

        public Builder extendsType(String type) { this.extendsType = type; return this; }
        public Builder feature(Feature feature) { this.features.add(feature); return this; }
        // repeated assignments overwrite, last one wins
        public Builder symptom(String symptom) { this.symptom = symptom; return this; }
        public Builder treatment(String treatment) { this.treatment = treatment; return this; }

        public Smell build() {
            return new Smell(name, extendsType, features, symptom, treatment);
        }
    }
}
