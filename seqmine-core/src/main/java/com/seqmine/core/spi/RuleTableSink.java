package com.seqmine.core.spi;

import com.seqmine.core.model.DecomposedRuleTable;

/**
 * Destination for decomposed rule tables.
 * Each row is persisted with the columns LHS, RHS, support, confidence, lift.
 */
public interface RuleTableSink {

    /**
     * Persist the table, replacing any earlier content.
     * 
     * @param table The rules to persist
     * @throws com.seqmine.core.exception.TableIoException if the backing store cannot be written
     */
    void write(DecomposedRuleTable table);

    /**
     * Where the rules go, for logging.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
