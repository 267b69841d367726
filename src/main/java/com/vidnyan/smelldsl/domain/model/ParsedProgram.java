package com.vidnyan.smelldsl.domain.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything a SmellDSL document declares, in declaration order.
 * Built once by the parser and read-only afterwards. Duplicate names are kept
 * here so the semantic analyzer can report them.
 */
public record ParsedProgram(
    List<String> smellTypes,
    List<Smell> smells,
    List<Rule> rules
) {

    public ParsedProgram {
        smellTypes = List.copyOf(smellTypes);
        smells = List.copyOf(smells);
        rules = List.copyOf(rules);
    }

    /**
     * First smell declared with the given name.
     */
    public Optional<Smell> findSmell(String name) {
        return smells.stream()
                .filter(s -> s.name().equals(name))
                .findFirst();
    }

    /**
     * Names of every feature declared by any smell.
     */
    public Set<String> declaredFeatureNames() {
        return smells.stream()
                .flatMap(s -> s.features().stream())
                .map(Feature::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Human readable overview of the program.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();

        sb.append("Declared smell types (").append(smellTypes.size()).append("):\n");
        sb.append(smellTypes.isEmpty() ? "  - none" : "  - " + String.join(", ", smellTypes)).append('\n');

        sb.append("\nDefined smells (").append(smells.size()).append("):\n");
        if (smells.isEmpty()) {
            sb.append("  - none\n");
        }
        for (Smell smell : smells) {
            sb.append("\n  Smell: ").append(smell.name()).append('\n');
            smell.parent().ifPresent(p -> sb.append("    - Extends: ").append(p).append('\n'));
            for (Feature feature : smell.features()) {
                sb.append("    - Feature: ").append(feature.name())
                        .append(" (thresholds: ").append(String.join(", ", feature.thresholds())).append(")\n");
            }
            if (smell.symptom() != null) {
                sb.append("    - Symptom: ").append(smell.symptom()).append('\n');
            }
            if (smell.treatment() != null) {
                sb.append("    - Treatment: ").append(smell.treatment()).append('\n');
            }
        }

        sb.append("\nDetection rules (").append(rules.size()).append("):\n");
        if (rules.isEmpty()) {
            sb.append("  - none\n");
        }
        for (Rule rule : rules) {
            sb.append("\n  Rule: ").append(rule.name()).append('\n');
            sb.append("    - Condition: ").append(rule.condition()).append('\n');
            sb.append("    - Action: ").append(rule.action()).append('\n');
        }
        return sb.toString();
    }
}
