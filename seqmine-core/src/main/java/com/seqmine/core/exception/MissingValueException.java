package com.seqmine.core.exception;

/**
 * Thrown when a record lacks a value the pipeline cannot do without
 * (a session key or an action label).
 */
public class MissingValueException extends SeqMineException {
    
    public static final String ERROR_CODE = "MISSING_VALUE";
    
    private final int recordPosition;
    
    public MissingValueException(String field, int recordPosition) {
        super(ERROR_CODE, String.format(
            "Missing value for field '%s' at record %d",
            field, recordPosition
        ));
        this.recordPosition = recordPosition;
    }
    
    public int getRecordPosition() {
        return recordPosition;
    }
}
