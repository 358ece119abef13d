package com.seqmine.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observed action after temporal normalization.
 * 
 * Invariants:
 * - sessionKey is non-null
 * - timeDiff is null for the first event of a session, otherwise >= 0 seconds
 * - fields are keyed by canonical column names
 */
public record EventRecord(
    // Position of the source row in the raw table
    int sourcePosition,
    
    Object sessionKey,
    Instant timestamp,
    
    // All raw fields under canonical names
    Map<String, Object> fields,
    
    // Seconds since the previous event of the same session
    Double timeDiff
) {
    public EventRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Value of a canonical field, or null.
     */
    public Object field(String canonicalName) {
        return fields.get(canonicalName);
    }

    public boolean isSessionStart() {
        return timeDiff == null;
    }

    public EventRecord withTimeDiff(Double timeDiff) {
        return new EventRecord(sourcePosition, sessionKey, timestamp, fields, timeDiff);
    }
}
