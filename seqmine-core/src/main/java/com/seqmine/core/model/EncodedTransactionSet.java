package com.seqmine.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Mining-engine input: one encoded transaction per session.
 * 
 * Invariants:
 * - sessionKey to sequenceId is a bijection onto 1..size()
 * - every transaction symbol is in the symbol dictionary
 */
public record EncodedTransactionSet(
    SortedMap<Integer, EncodedTransaction> transactions,
    Map<Object, Integer> sequenceIds,
    SymbolDictionary symbols
) {
    public EncodedTransactionSet {
        transactions = Collections.unmodifiableSortedMap(new TreeMap<>(transactions));
        sequenceIds = Collections.unmodifiableMap(new LinkedHashMap<>(sequenceIds));
    }

    public int size() {
        return transactions.size();
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    /**
     * Transaction for a sequence id.
     */
    public Optional<EncodedTransaction> get(int sequenceId) {
        return Optional.ofNullable(transactions.get(sequenceId));
    }

    /**
     * Sequence id assigned to a session key.
     */
    public Optional<Integer> sequenceIdOf(Object sessionKey) {
        return Optional.ofNullable(sequenceIds.get(sessionKey));
    }

    /**
     * Transactions in sequence-id order.
     */
    public Collection<EncodedTransaction> values() {
        return transactions.values();
    }

    /**
     * Total number of items across all transactions.
     */
    public int totalEvents() {
        return transactions.values().stream().mapToInt(EncodedTransaction::length).sum();
    }
}
