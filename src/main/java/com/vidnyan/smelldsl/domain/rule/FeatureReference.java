package com.vidnyan.smelldsl.domain.rule;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code Smell.Feature} reference found at the start of a rule condition.
 */
public record FeatureReference(
    String smellName,
    String featureName
) {

    private static final Pattern LEADING_REFERENCE =
            Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\.([A-Za-z_][A-Za-z0-9_]*)");

    /**
     * Reference at the start of the condition, or empty when the condition is
     * free-form and should not be validated.
     */
    public static Optional<FeatureReference> leading(String condition) {
        Matcher matcher = LEADING_REFERENCE.matcher(condition);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new FeatureReference(matcher.group(1), matcher.group(2)));
    }

    @Override
    public String toString() {
        return smellName + "." + featureName;
    }
}
