package com.di.organizer.codec;

import java.nio.file.Path;

/**
 * Picks the codec for a backing file.
 */
public final class TabularCodecs {

    private TabularCodecs() {
    }

    public static TabularCodec forPath(Path file, TabularFormat format, String sheetName) {
        TabularFormat resolved = format == null || format == TabularFormat.AUTO ? detect(file) : format;
        switch (resolved) {
            case CSV:
                return new CsvTabularCodec();
            case XLSX:
            default:
                return new XlsxTabularCodec(sheetName);
        }
    }

    static TabularFormat detect(Path file) {
        if (file == null || file.getFileName() == null) {
            return TabularFormat.XLSX;
        }
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".csv") ? TabularFormat.CSV : TabularFormat.XLSX;
    }
}
