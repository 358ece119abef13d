package com.seqmine.core.exception;

import java.util.Collection;

/**
 * Thrown when a user-supplied field name does not resolve to a column,
 * or when mining parameters are out of range.
 */
public class ConfigurationException extends SeqMineException {
    
    public static final String ERROR_CODE = "CONFIGURATION_ERROR";
    
    private final String field;
    
    public ConfigurationException(String message) {
        super(ERROR_CODE, message);
        this.field = null;
    }
    
    public ConfigurationException(String field, String canonicalName, Collection<String> availableFields) {
        super(ERROR_CODE, String.format(
            "Field '%s' (canonical '%s') not found; available fields: %s",
            field, canonicalName, availableFields
        ));
        this.field = field;
    }
    
    /**
     * The field name as the caller supplied it, or null for parameter errors.
     */
    public String getField() {
        return field;
    }
}
