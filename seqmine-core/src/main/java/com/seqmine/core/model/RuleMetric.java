package com.seqmine.core.model;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Numeric rule metrics usable as a ranking key.
 */
public enum RuleMetric {
    SUPPORT(DecomposedRule::support),
    CONFIDENCE(DecomposedRule::confidence),
    LIFT(DecomposedRule::lift);

    private final ToDoubleFunction<DecomposedRule> extractor;

    RuleMetric(ToDoubleFunction<DecomposedRule> extractor) {
        this.extractor = extractor;
    }

    public double valueOf(DecomposedRule rule) {
        return extractor.applyAsDouble(rule);
    }

    /**
     * Resolve a metric from a case-insensitive name such as {@code "lift"}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static RuleMetric fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Metric name must not be null");
        }
        return RuleMetric.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
