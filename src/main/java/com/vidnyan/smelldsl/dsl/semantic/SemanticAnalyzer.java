package com.vidnyan.smelldsl.dsl.semantic;

import com.vidnyan.smelldsl.domain.error.SemanticException;
import com.vidnyan.smelldsl.domain.model.ParsedProgram;
import com.vidnyan.smelldsl.domain.model.Rule;
import com.vidnyan.smelldsl.domain.model.Smell;
import com.vidnyan.smelldsl.domain.rule.FeatureReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a parsed program for consistency. Never modifies it.
 *
 * Checks run in order and the first violation aborts:
 * <ol>
 *   <li>duplicate names, with smell types, smells and rules as separate namespaces</li>
 *   <li>every {@code extends} target is a declared smell type</li>
 *   <li>a rule condition starting with {@code Smell.Feature} names a declared smell
 *       and one of its features</li>
 * </ol>
 * Conditions that do not start with {@code Smell.Feature} are left unvalidated.
 */
@Slf4j
@Component
public class SemanticAnalyzer {

    /**
     * @throws SemanticException naming the first offending declaration
     */
    public void analyze(ParsedProgram program) {
        checkForDuplicates(program);
        checkExtendsValidity(program);
        checkRuleReferences(program);
    }

    private void checkForDuplicates(ParsedProgram program) {
        requireUnique("smelltype", program.smellTypes());
        requireUnique("smell", program.smells().stream().map(Smell::name).toList());
        requireUnique("rule", program.rules().stream().map(Rule::name).toList());
    }

    private void requireUnique(String declaration, List<String> names) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new SemanticException(
                        String.format("Duplicate '%s' name: '%s'", declaration, name));
            }
        }
    }

    private void checkExtendsValidity(ParsedProgram program) {
        Set<String> smellTypes = Set.copyOf(program.smellTypes());
        for (Smell smell : program.smells()) {
            Optional<String> parent = smell.parent();
            if (parent.isPresent() && !smellTypes.contains(parent.get())) {
                throw new SemanticException(String.format(
                        "Error in smell '%s': extends undeclared smelltype '%s'",
                        smell.name(), parent.get()));
            }
        }
    }

    private void checkRuleReferences(ParsedProgram program) {
        for (Rule rule : program.rules()) {
            Optional<FeatureReference> reference = FeatureReference.leading(rule.condition());
            if (reference.isEmpty()) {
                log.debug("Rule '{}' has a free-form condition and is not validated", rule.name());
                continue;
            }

            FeatureReference ref = reference.get();
            Smell smell = program.findSmell(ref.smellName())
                    .orElseThrow(() -> new SemanticException(String.format(
                            "Error in rule '%s': smell '%s' is not defined", rule.name(), ref.smellName())));
            if (!smell.declaresFeature(ref.featureName())) {
                throw new SemanticException(String.format(
                        "Error in rule '%s': feature '%s' does not exist in smell '%s'",
                        rule.name(), ref.featureName(), ref.smellName()));
            }
        }
    }
}
