package com.seqmine.engine;

import com.seqmine.core.model.RawTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interaction-log tables shared by the engine tests.
 */
public final class Fixtures {

    public static final List<String> COLUMNS = List.of("Username", "Action", "DateTime");

    private Fixtures() {
    }

    /**
     * Two sessions: S1 clicks A then B, S2 scrolls. Rows are deliberately out of order.
     */
    public static RawTable scenarioA() {
        return table(COLUMNS,
            row("S2", "scroll", "2024-01-15 09:00:00"),
            row("S1", "click B", "2024-01-15 10:00:02"),
            row("S1", "click A", "2024-01-15 10:00:00")
        );
    }

    public static RawTable table(List<String> columns, List<?>... rows) {
        List<Map<String, Object>> maps = new ArrayList<>();
        for (List<?> values : rows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), values.get(i));
            }
            maps.add(row);
        }
        return RawTable.of(columns, maps);
    }

    public static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }
}
