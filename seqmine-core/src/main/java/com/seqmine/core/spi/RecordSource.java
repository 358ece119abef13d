package com.seqmine.core.spi;

import com.seqmine.core.model.RawTable;

/**
 * Tabular source of raw interaction records.
 */
public interface RecordSource {

    /**
     * Read every record.
     * 
     * @return The records with their raw column names
     * @throws com.seqmine.core.exception.TableIoException if the backing store cannot be read
     */
    RawTable read();

    /**
     * Where the records come from, for logging.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
