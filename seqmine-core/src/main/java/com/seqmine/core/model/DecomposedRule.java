package com.seqmine.core.model;

/**
 * A rule split into antecedent and consequent.
 * 
 * A null rhs marks a malformed rule: the formatted string did not contain
 * the separator exactly once, and lhs holds the whole string.
 */
public record DecomposedRule(
    String lhs,
    String rhs,
    double support,
    double confidence,
    double lift
) {
    public static final String SEPARATOR = " => ";

    public boolean isMalformed() {
        return rhs == null;
    }

    /**
     * The formatted rule string this row was decomposed from.
     */
    public String rule() {
        return isMalformed() ? lhs : lhs + SEPARATOR + rhs;
    }
}
