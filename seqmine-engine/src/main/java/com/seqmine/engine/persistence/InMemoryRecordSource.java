package com.seqmine.engine.persistence;

import com.seqmine.core.model.RawTable;
import com.seqmine.core.spi.RecordSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of RecordSource.
 * For embedding and testing purposes.
 */
public class InMemoryRecordSource implements RecordSource {
    
    private final RawTable table;
    
    public InMemoryRecordSource(RawTable table) {
        this.table = table;
    }
    
    /**
     * Build a source from column names and positional row values.
     */
    public static InMemoryRecordSource of(List<String> columns, List<List<Object>> rows) {
        List<Map<String, Object>> maps = new ArrayList<>(rows.size());
        for (List<Object> values : rows) {
            if (values.size() != columns.size()) {
                throw new IllegalArgumentException(
                    "Row has " + values.size() + " values for " + columns.size() + " columns");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), values.get(i));
            }
            maps.add(row);
        }
        return new InMemoryRecordSource(RawTable.of(columns, maps));
    }
    
    @Override
    public RawTable read() {
        return table;
    }
    
    @Override
    public String describe() {
        return "memory[" + table.size() + " records]";
    }
}
