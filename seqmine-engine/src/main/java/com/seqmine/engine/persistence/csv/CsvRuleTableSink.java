package com.seqmine.engine.persistence.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.seqmine.core.exception.TableIoException;
import com.seqmine.core.model.DecomposedRule;
import com.seqmine.core.model.DecomposedRuleTable;
import com.seqmine.core.spi.RuleTableSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delimited-text implementation of RuleTableSink.
 * 
 * Writes a header row and one row per rule with the columns
 * LHS, RHS, support, confidence, lift. A missing RHS is written as {@code NA}.
 */
public class CsvRuleTableSink implements RuleTableSink {

    private static final Logger log = LoggerFactory.getLogger(CsvRuleTableSink.class);

    public static final String LHS = "LHS";
    public static final String RHS = "RHS";
    public static final String SUPPORT = "support";
    public static final String CONFIDENCE = "confidence";
    public static final String LIFT = "lift";
    public static final String MISSING = "NA";

    private final Path path;
    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema = CsvSchema.builder()
        .addColumn(LHS, CsvSchema.ColumnType.STRING)
        .addColumn(RHS, CsvSchema.ColumnType.STRING)
        .addColumn(SUPPORT, CsvSchema.ColumnType.NUMBER)
        .addColumn(CONFIDENCE, CsvSchema.ColumnType.NUMBER)
        .addColumn(LIFT, CsvSchema.ColumnType.NUMBER)
        .build()
        .withHeader()
        .withNullValue(MISSING);

    public CsvRuleTableSink(Path path) {
        this.path = path;
    }

    @Override
    public void write(DecomposedRuleTable table) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 SequenceWriter rows = mapper.writer(schema).writeValues(writer)) {
                for (DecomposedRule rule : table.rows()) {
                    rows.write(toRow(rule));
                }
            }
            log.info("Wrote {} rules to {}", table.size(), path);
        } catch (IOException e) {
            throw new TableIoException(path.toString(), e);
        }
    }

    private static Map<String, Object> toRow(DecomposedRule rule) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(LHS, rule.lhs());
        row.put(RHS, rule.rhs());
        row.put(SUPPORT, rule.support());
        row.put(CONFIDENCE, rule.confidence());
        row.put(LIFT, rule.lift());
        return row;
    }

    @Override
    public String describe() {
        return path.getFileName().toString();
    }
}
