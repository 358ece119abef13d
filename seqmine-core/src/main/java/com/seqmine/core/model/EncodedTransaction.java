package com.seqmine.core.model;

import java.util.List;

/**
 * Mining-engine input for one session.
 * 
 * Invariants:
 * - sequenceId >= 1
 * - items is non-empty
 * - item event ids are exactly 1..n in order
 */
public record EncodedTransaction(
    int sequenceId,
    Object sessionKey,
    List<TransactionItem> items
) {
    public EncodedTransaction {
        items = List.copyOf(items);
    }

    public int length() {
        return items.size();
    }

    /**
     * Symbols in event order.
     */
    public List<String> symbols() {
        return items.stream().map(TransactionItem::symbol).toList();
    }
}
