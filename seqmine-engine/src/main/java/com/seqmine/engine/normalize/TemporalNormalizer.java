package com.seqmine.engine.normalize;

import com.seqmine.core.exception.MissingValueException;
import com.seqmine.core.exception.TimestampParseException;
import com.seqmine.core.model.EventRecord;
import com.seqmine.core.model.FieldNames;
import com.seqmine.core.model.NormalizedRecords;
import com.seqmine.core.model.NormalizerOptions;
import com.seqmine.core.model.RawTable;
import com.seqmine.core.model.SessionKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleans raw interaction records.
 * 
 * Steps:
 * 1. Canonicalize column names and resolve the session-key and timestamp fields
 * 2. Parse every timestamp
 * 3. Sort by (session key, timestamp), stable on ties
 * 4. Compute the gap in seconds to the previous event of the same session
 * 
 * The input table is never modified.
 */
public class TemporalNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TemporalNormalizer.class);

    /**
     * Orders records by session key, then timestamp. List.sort is stable,
     * so records with equal keys and timestamps keep their input order.
     */
    static final Comparator<EventRecord> SESSION_TIME_ORDER =
        Comparator.<EventRecord, Object>comparing(EventRecord::sessionKey, SessionKeys.ORDER)
            .thenComparing(EventRecord::timestamp);

    private final TimestampParser timestampParser;

    public TemporalNormalizer(NormalizerOptions options) {
        this.timestampParser = new TimestampParser(options);
    }

    public TemporalNormalizer() {
        this(NormalizerOptions.defaults());
    }

    /**
     * Normalize raw records.
     * 
     * @param table Raw records
     * @param sessionKeyField User-supplied name of the session identifier column
     * @param timestampField User-supplied name of the timestamp column
     * @return Records sorted by session and time, with time gaps
     * @throws com.seqmine.core.exception.ConfigurationException if a field does not resolve
     * @throws TimestampParseException if a timestamp cannot be parsed
     * @throws MissingValueException if a session key is missing
     */
    public NormalizedRecords normalize(RawTable table, String sessionKeyField, String timestampField) {
        List<String> canonicalColumns = FieldNames.canonicalizeAll(table.columns());
        String sessionColumn = FieldNames.resolve(sessionKeyField, canonicalColumns);
        String timestampColumn = FieldNames.resolve(timestampField, canonicalColumns);

        List<EventRecord> records = new ArrayList<>(table.size());
        for (int position = 0; position < table.size(); position++) {
            Map<String, Object> fields = renameFields(table, position, canonicalColumns);

            Object sessionKey = fields.get(sessionColumn);
            if (sessionKey == null) {
                throw new MissingValueException(sessionColumn, position);
            }

            Object rawTimestamp = fields.get(timestampColumn);
            Instant timestamp;
            try {
                timestamp = timestampParser.parse(rawTimestamp);
            } catch (DateTimeException | ArithmeticException e) {
                throw new TimestampParseException(position, timestampColumn, rawTimestamp, e);
            }

            records.add(new EventRecord(position, sessionKey, timestamp, fields, null));
        }

        records.sort(SESSION_TIME_ORDER);
        List<EventRecord> withGaps = computeTimeDiffs(records);

        NormalizedRecords result = new NormalizedRecords(
            canonicalColumns, sessionColumn, timestampColumn, withGaps);
        log.info("Normalized {} records into {} sessions (session field '{}', timestamp field '{}')",
            result.size(), result.sessionCount(), sessionColumn, timestampColumn);
        return result;
    }

    private static Map<String, Object> renameFields(RawTable table, int position, List<String> canonicalColumns) {
        Map<String, Object> fields = new LinkedHashMap<>();
        List<String> rawColumns = table.columns();
        for (int i = 0; i < rawColumns.size(); i++) {
            fields.put(canonicalColumns.get(i), table.value(position, rawColumns.get(i)));
        }
        return fields;
    }

    /**
     * Records must already be sorted by session and time.
     */
    static List<EventRecord> computeTimeDiffs(List<EventRecord> sorted) {
        List<EventRecord> result = new ArrayList<>(sorted.size());
        EventRecord previous = null;
        for (EventRecord current : sorted) {
            Double timeDiff = null;
            if (previous != null && SessionKeys.compare(previous.sessionKey(), current.sessionKey()) == 0) {
                timeDiff = secondsBetween(previous.timestamp(), current.timestamp());
            }
            result.add(current.withTimeDiff(timeDiff));
            previous = current;
        }
        return result;
    }

    static double secondsBetween(Instant from, Instant to) {
        Duration gap = Duration.between(from, to);
        return gap.getSeconds() + gap.getNano() / 1_000_000_000.0;
    }
}
