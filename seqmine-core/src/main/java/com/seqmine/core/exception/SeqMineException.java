package com.seqmine.core.exception;

/**
 * Base exception for all SeqMine errors.
 */
public class SeqMineException extends RuntimeException {
    
    private final String errorCode;
    
    public SeqMineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public SeqMineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
