package com.seqmine.core.model;

/**
 * A rule as produced by the mining engine, before decomposition.
 * 
 * @param rule formatted {@code <antecedent> => <consequent>} string
 */
public record Rule(
    String rule,
    double support,
    double confidence,
    double lift
) {
}
