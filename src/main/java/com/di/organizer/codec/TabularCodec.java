package com.di.organizer.codec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes a row-oriented table file. Rows are loosely typed maps keyed by column header;
 * interpreting the values is left to the caller.
 */
public interface TabularCodec {

    /**
     * Decodes every data row of the file in file order. The first row is the header.
     *
     * @throws IOException when the file cannot be read or is not a valid table of this format
     */
    List<Map<String, Object>> read(Path file) throws IOException;

    /**
     * Replaces the file with a header row (in {@code columns} order) followed by one row per map.
     * Values for columns absent from a row are written empty; keys not listed in {@code columns}
     * are ignored. Readers of {@code file} never observe a partially written table.
     *
     * @throws IOException when the table cannot be encoded or the file cannot be replaced
     */
    void write(Path file, List<String> columns, List<? extends Map<String, ?>> rows) throws IOException;
}
