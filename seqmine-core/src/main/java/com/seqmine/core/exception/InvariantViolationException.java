package com.seqmine.core.exception;

/**
 * Internal invariant broken while encoding transactions.
 * Never user-correctable.
 */
public class InvariantViolationException extends SeqMineException {
    
    public static final String ERROR_CODE = "INVARIANT_VIOLATION";
    
    public InvariantViolationException(String message) {
        super(ERROR_CODE, message);
    }
}
