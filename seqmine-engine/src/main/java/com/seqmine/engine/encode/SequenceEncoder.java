package com.seqmine.engine.encode;

import com.seqmine.core.exception.InvariantViolationException;
import com.seqmine.core.exception.MissingValueException;
import com.seqmine.core.model.EncodedTransaction;
import com.seqmine.core.model.EncodedTransactionSet;
import com.seqmine.core.model.EventRecord;
import com.seqmine.core.model.FieldNames;
import com.seqmine.core.model.NormalizedRecords;
import com.seqmine.core.model.SessionKeys;
import com.seqmine.core.model.SymbolDictionary;
import com.seqmine.core.model.TransactionItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Encodes normalized records into the transaction set a sequence miner consumes.
 * 
 * Per session:
 * - sequenceId: dense 1..m, assigned in session-key order over the full key set
 * - eventId: 1..n in (timestamp, input order)
 * - symbol: the sanitized action label
 * 
 * Records are re-sorted here; the encoder does not rely on the caller having
 * run the normalizer's sort.
 */
public class SequenceEncoder {

    private static final Logger log = LoggerFactory.getLogger(SequenceEncoder.class);

    private final SymbolSanitizer sanitizer;

    public SequenceEncoder(SymbolSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public SequenceEncoder() {
        this(new SymbolSanitizer());
    }

    /**
     * Encode normalized records.
     * 
     * @param normalized Records from the temporal normalizer
     * @param sessionKeyField User-supplied name of the session identifier column
     * @param actionField User-supplied name of the action label column
     * @return One transaction per distinct session key
     * @throws com.seqmine.core.exception.ConfigurationException if a field does not resolve
     * @throws MissingValueException if a session key or action label is missing
     */
    public EncodedTransactionSet encode(NormalizedRecords normalized, String sessionKeyField, String actionField) {
        String sessionColumn = FieldNames.resolve(sessionKeyField, normalized.columns());
        String actionColumn = FieldNames.resolve(actionField, normalized.columns());

        List<EventRecord> sorted = new ArrayList<>(normalized.records());
        Comparator<EventRecord> bySessionThenTime =
            Comparator.<EventRecord, Object>comparing(r -> r.field(sessionColumn), SessionKeys.ORDER)
                .thenComparing(EventRecord::timestamp);
        for (EventRecord record : sorted) {
            if (record.field(sessionColumn) == null) {
                throw new MissingValueException(sessionColumn, record.sourcePosition());
            }
        }
        sorted.sort(bySessionThenTime);

        Map<Object, Integer> sequenceIds = assignSequenceIds(sorted, sessionColumn);

        // sequenceId -> symbols in event order
        SortedMap<Integer, List<String>> grouped = new TreeMap<>();
        Map<Integer, Object> keysById = new LinkedHashMap<>();
        for (Map.Entry<Object, Integer> entry : sequenceIds.entrySet()) {
            grouped.put(entry.getValue(), new ArrayList<>());
            keysById.put(entry.getValue(), entry.getKey());
        }
        for (EventRecord record : sorted) {
            int sequenceId = sequenceIds.get(record.field(sessionColumn));
            grouped.get(sequenceId).add(symbolOf(record, actionColumn));
        }

        SortedMap<Integer, EncodedTransaction> transactions = new TreeMap<>();
        List<String> allSymbols = new ArrayList<>();
        for (Map.Entry<Integer, List<String>> group : grouped.entrySet()) {
            List<String> symbols = group.getValue();
            if (symbols.isEmpty()) {
                throw new InvariantViolationException("Session group " + group.getKey() + " is empty");
            }
            List<TransactionItem> items = new ArrayList<>(symbols.size());
            for (int i = 0; i < symbols.size(); i++) {
                items.add(new TransactionItem(i + 1, symbols.get(i)));
            }
            EncodedTransaction transaction =
                new EncodedTransaction(group.getKey(), keysById.get(group.getKey()), items);
            verifyOrdinals(transaction);
            transactions.put(group.getKey(), transaction);
            allSymbols.addAll(symbols);
            log.debug("Encoded session {} as sequence {} with {} events",
                transaction.sessionKey(), transaction.sequenceId(), transaction.length());
        }

        EncodedTransactionSet result =
            new EncodedTransactionSet(transactions, sequenceIds, SymbolDictionary.of(allSymbols));
        log.info("Encoded {} events into {} transactions over {} distinct symbols",
            result.totalEvents(), result.size(), result.symbols().size());
        return result;
    }

    /**
     * Assign 1..m to the distinct keys of the full, sorted record list.
     * Computed in one pass before any per-session work so the mapping is a bijection.
     */
    private static Map<Object, Integer> assignSequenceIds(List<EventRecord> sorted, String sessionColumn) {
        TreeSet<Object> distinct = new TreeSet<>(SessionKeys.ORDER);
        for (EventRecord record : sorted) {
            distinct.add(record.field(sessionColumn));
        }
        Map<Object, Integer> ids = new TreeMap<>(SessionKeys.ORDER);
        int next = 1;
        for (Object key : distinct) {
            ids.put(key, next++);
        }
        return ids;
    }

    private String symbolOf(EventRecord record, String actionColumn) {
        Object label = record.field(actionColumn);
        if (label == null) {
            throw new MissingValueException(actionColumn, record.sourcePosition());
        }
        String symbol = sanitizer.sanitize(label.toString());
        if (symbol.isEmpty()) {
            throw new MissingValueException(actionColumn, record.sourcePosition());
        }
        return symbol;
    }

    private static void verifyOrdinals(EncodedTransaction transaction) {
        List<TransactionItem> items = transaction.items();
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).eventId() != i + 1) {
                throw new InvariantViolationException(String.format(
                    "Sequence %d has event id %d at position %d",
                    transaction.sequenceId(), items.get(i).eventId(), i + 1));
            }
        }
    }
}
