package com.seqmine.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered table of decomposed rules.
 * 
 * Invariants:
 * - malformedPositions lists, in ascending order, exactly the positions of rows with a null rhs
 */
public record DecomposedRuleTable(
    List<DecomposedRule> rows,
    List<Integer> malformedPositions
) {
    public DecomposedRuleTable {
        rows = List.copyOf(rows);
        malformedPositions = List.copyOf(malformedPositions);
    }

    /**
     * Build a table, deriving the malformed positions from the rows.
     */
    public static DecomposedRuleTable of(List<DecomposedRule> rows) {
        List<Integer> malformed = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).isMalformed()) {
                malformed.add(i);
            }
        }
        return new DecomposedRuleTable(rows, malformed);
    }

    public static DecomposedRuleTable empty() {
        return new DecomposedRuleTable(List.of(), List.of());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public DecomposedRule get(int position) {
        return rows.get(position);
    }

    public int malformedCount() {
        return malformedPositions.size();
    }

    /**
     * The table without malformed rows.
     */
    public DecomposedRuleTable wellFormed() {
        if (malformedPositions.isEmpty()) {
            return this;
        }
        return new DecomposedRuleTable(
            rows.stream().filter(r -> !r.isMalformed()).toList(),
            List.of()
        );
    }
}
