package com.seqmine.engine.persistence.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.seqmine.core.exception.TableIoException;
import com.seqmine.core.model.RawTable;
import com.seqmine.core.spi.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delimited-text implementation of RecordSource.
 * 
 * The first row holds the column names. Empty cells are read as null;
 * every other value stays a string and is interpreted by the pipeline stages.
 */
public class CsvRecordSource implements RecordSource {

    private static final Logger log = LoggerFactory.getLogger(CsvRecordSource.class);

    private final Path path;
    private final CsvMapper mapper;
    private final CsvSchema schema;

    public CsvRecordSource(Path path) {
        this(path, ',');
    }

    public CsvRecordSource(Path path, char separator) {
        this.path = path;
        this.mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
        this.schema = CsvSchema.emptySchema().withColumnSeparator(separator);
    }

    @Override
    public RawTable read() {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = mapper.readerFor(String[].class).with(schema).readValues(reader)) {
            if (!it.hasNext()) {
                return RawTable.of(List.of(), List.of());
            }
            List<String> columns = Arrays.asList(it.next());
            List<Map<String, Object>> rows = new ArrayList<>();
            while (it.hasNext()) {
                String[] values = it.next();
                if (values.length == 0 || (values.length == 1 && values[0].isEmpty())) {
                    continue;
                }
                rows.add(toRow(columns, values));
            }
            log.info("Read {} records with columns {} from {}", rows.size(), columns, path);
            return RawTable.of(columns, rows);
        } catch (IOException | RuntimeException e) {
            throw new TableIoException(path.toString(), e);
        }
    }

    private Map<String, Object> toRow(List<String> columns, String[] values) {
        if (values.length > columns.size()) {
            throw new IllegalStateException(String.format(
                "Row has %d values but the header has %d columns", values.length, columns.size()));
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String value = i < values.length ? values[i] : null;
            row.put(columns.get(i), value == null || value.isEmpty() ? null : value);
        }
        return row;
    }

    @Override
    public String describe() {
        return path.getFileName().toString();
    }
}
