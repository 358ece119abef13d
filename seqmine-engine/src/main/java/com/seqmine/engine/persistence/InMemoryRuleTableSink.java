package com.seqmine.engine.persistence;

import com.seqmine.core.model.DecomposedRuleTable;
import com.seqmine.core.spi.RuleTableSink;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of RuleTableSink.
 * Keeps the last table written.
 */
public class InMemoryRuleTableSink implements RuleTableSink {
    
    private final AtomicReference<DecomposedRuleTable> last = new AtomicReference<>();
    
    @Override
    public void write(DecomposedRuleTable table) {
        last.set(table);
    }
    
    public Optional<DecomposedRuleTable> lastWritten() {
        return Optional.ofNullable(last.get());
    }
    
    @Override
    public String describe() {
        return "memory";
    }
}
