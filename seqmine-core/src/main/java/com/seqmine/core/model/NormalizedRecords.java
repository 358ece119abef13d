package com.seqmine.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Output of temporal normalization: records sorted by (session key, timestamp).
 * 
 * Invariants:
 * - records of one session are contiguous and ordered non-decreasing by timestamp
 * - sessionKeyField and timestampField are members of columns
 */
public record NormalizedRecords(
    List<String> columns,
    String sessionKeyField,
    String timestampField,
    List<EventRecord> records
) {
    public NormalizedRecords {
        columns = List.copyOf(columns);
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Number of distinct session keys, as distinguished by {@link SessionKeys#ORDER}.
     */
    public int sessionCount() {
        Set<Object> keys = new TreeSet<>(SessionKeys.ORDER);
        for (EventRecord record : records) {
            keys.add(record.sessionKey());
        }
        return keys.size();
    }

    /**
     * Subset keeping the records that match the predicate. Order is preserved.
     * Time gaps are not recomputed: they still describe the full session.
     */
    public NormalizedRecords filter(Predicate<EventRecord> predicate) {
        return new NormalizedRecords(
            columns, sessionKeyField, timestampField,
            records.stream().filter(predicate).toList()
        );
    }

    /**
     * Subset keeping records whose field equals the value (compared by string form).
     *
     * @param field user-supplied field name, canonicalized before lookup
     */
    public NormalizedRecords where(String field, Object value) {
        String canonical = FieldNames.resolve(field, columns);
        String expected = value == null ? null : value.toString();
        return filter(r -> {
            Object actual = r.field(canonical);
            return Objects.equals(actual == null ? null : actual.toString(), expected);
        });
    }
}
