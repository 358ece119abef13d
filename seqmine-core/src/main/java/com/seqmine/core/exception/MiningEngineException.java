package com.seqmine.core.exception;

/**
 * Thrown when the external mining engine fails or returns no result.
 */
public class MiningEngineException extends SeqMineException {
    
    public static final String ERROR_CODE = "MINING_ENGINE_FAILED";
    
    public MiningEngineException(String engineName, String reason) {
        super(ERROR_CODE, String.format("Mining engine %s failed: %s", engineName, reason));
    }
    
    public MiningEngineException(String engineName, Throwable cause) {
        super(ERROR_CODE, String.format("Mining engine %s failed: %s", engineName, cause.getMessage()), cause);
    }
}
