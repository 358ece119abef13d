package com.seqmine.core.exception;

/**
 * Thrown when a timestamp value cannot be parsed.
 * Carries the 0-based position of the offending record in the input.
 */
public class TimestampParseException extends SeqMineException {
    
    public static final String ERROR_CODE = "TIMESTAMP_PARSE_ERROR";
    
    private final int recordPosition;
    private final Object value;
    
    public TimestampParseException(int recordPosition, String field, Object value, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Unparseable timestamp in field '%s' at record %d: '%s'",
            field, recordPosition, value
        ), cause);
        this.recordPosition = recordPosition;
        this.value = value;
    }
    
    public int getRecordPosition() {
        return recordPosition;
    }
    
    public Object getValue() {
        return value;
    }
}
