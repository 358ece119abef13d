package com.seqmine.core.model;

import com.seqmine.core.exception.ConfigurationException;

/**
 * Parameters handed through, untouched, to the external mining engine.
 * Immutable.
 * 
 * Invariants:
 * - minSupport in (0.0, 1.0]
 * - maxLength >= 1
 * - minGap >= 0
 * - maxGap is null (unbounded) or >= minGap
 * - minConfidence in [0.0, 1.0]
 */
public record MiningParameters(
    // Fraction of sessions a sequence must occur in to be frequent
    double minSupport,
    
    // Maximum number of items in a mined sequence
    int maxLength,
    
    // Allowed ordinal distance between consecutive items of a sequence
    int minGap,
    Integer maxGap,
    
    // Minimum conditional probability for a rule to be kept
    double minConfidence
) {
    public MiningParameters {
        if (!(minSupport > 0.0 && minSupport <= 1.0)) {
            throw new ConfigurationException("minSupport must be in (0, 1]: " + minSupport);
        }
        if (maxLength < 1) {
            throw new ConfigurationException("maxLength must be >= 1: " + maxLength);
        }
        if (minGap < 0) {
            throw new ConfigurationException("minGap must be >= 0: " + minGap);
        }
        if (maxGap != null && maxGap < minGap) {
            throw new ConfigurationException(
                "maxGap must be >= minGap: maxGap=" + maxGap + ", minGap=" + minGap);
        }
        if (!(minConfidence >= 0.0 && minConfidence <= 1.0)) {
            throw new ConfigurationException("minConfidence must be in [0, 1]: " + minConfidence);
        }
    }

    /**
     * Defaults of the interaction-log study: support 0.2, length 4, gaps 1..2, confidence 0.5.
     */
    public static MiningParameters defaults() {
        return builder().build();
    }

    public boolean hasMaxGap() {
        return maxGap != null;
    }

    /**
     * Builder for MiningParameters.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double minSupport = 0.2;
        private int maxLength = 4;
        private int minGap = 1;
        private Integer maxGap = 2;
        private double minConfidence = 0.5;

        public Builder minSupport(double minSupport) {
            this.minSupport = minSupport;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder minGap(int minGap) {
            this.minGap = minGap;
            return this;
        }

        public Builder maxGap(Integer maxGap) {
            this.maxGap = maxGap;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public MiningParameters build() {
            return new MiningParameters(minSupport, maxLength, minGap, maxGap, minConfidence);
        }
    }
}
