package com.vidnyan.smelldsl.domain.rule;

import java.util.Locale;

/**
 * Tier a measured feature value falls into.
 */
public record FeatureState(
    String featureName,
    double measured,
    String label,
    Classification classification
) {

    public static final String NO_THRESHOLDS_LABEL = "Limites não definidos";
    public static final String VERY_LOW_LABEL = "MUITO BAIXO";

    public enum Classification {
        /** Value reached one of the declared tiers. */
        TIER,
        /** Value is below every tier. */
        BELOW_ALL_TIERS,
        /** No thresholds exist for the feature. */
        NO_THRESHOLDS
    }

    public static FeatureState tier(String featureName, double measured, String tier) {
        return new FeatureState(featureName, measured, tier.toUpperCase(Locale.ROOT), Classification.TIER);
    }

    public static FeatureState belowAllTiers(String featureName, double measured) {
        return new FeatureState(featureName, measured, VERY_LOW_LABEL, Classification.BELOW_ALL_TIERS);
    }

    public static FeatureState noThresholds(String featureName, double measured) {
        return new FeatureState(featureName, measured, NO_THRESHOLDS_LABEL, Classification.NO_THRESHOLDS);
    }
}
