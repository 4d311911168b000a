package com.di.organizer.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Comma-separated table codec (Jackson CSV). Every value is read back as a string; empty fields
 * are left out of the row.
 */
@Slf4j
public class CsvTabularCodec extends AbstractFileTabularCodec {

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public List<Map<String, Object>> read(Path file) throws IOException {
        if (Files.size(file) == 0) {
            return new ArrayList<>();
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            while (it.hasNextValue()) {
                Map<String, String> raw = it.nextValue();
                Map<String, Object> values = new LinkedHashMap<>();
                raw.forEach((header, value) -> {
                    if (value != null && !value.isEmpty()) {
                        values.put(header.trim(), value);
                    }
                });
                if (!values.isEmpty()) {
                    rows.add(values);
                }
            }
        } catch (RuntimeException e) {
            throw new IOException("Not a readable csv table: " + file + " (" + e.getMessage() + ")", e);
        }
        log.debug("[CSV] read {} rows from {}", rows.size(), file);
        return rows;
    }

    @Override
    protected void encode(OutputStream out, List<String> columns, List<? extends Map<String, ?>> rows) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder();
        columns.forEach(builder::addColumn);
        CsvSchema schema = builder.build().withHeader();
        try (SequenceWriter writer = mapper.writer(schema).writeValues(out)) {
            for (Map<String, ?> row : rows) {
                Map<String, Object> ordered = new LinkedHashMap<>();
                for (String column : columns) {
                    Object value = row == null ? null : row.get(column);
                    ordered.put(column, value == null ? "" : value);
                }
                writer.write(ordered);
            }
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to encode csv table: " + e.getOriginalMessage(), e);
        }
    }
}
