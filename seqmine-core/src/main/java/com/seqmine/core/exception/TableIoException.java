package com.seqmine.core.exception;

/**
 * Thrown when a record source or rule table sink cannot read or write its backing store.
 */
public class TableIoException extends SeqMineException {
    
    public static final String ERROR_CODE = "TABLE_IO_FAILED";
    
    public TableIoException(String location, Throwable cause) {
        super(ERROR_CODE, String.format("I/O failure on %s: %s", location, cause.getMessage()), cause);
    }
}
