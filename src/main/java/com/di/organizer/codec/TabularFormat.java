package com.di.organizer.codec;

/**
 * Encoding of the backing table file.
 */
public enum TabularFormat {
    /** Chosen from the file extension: .csv is CSV, anything else is xlsx. */
    AUTO,
    XLSX,
    CSV
}
