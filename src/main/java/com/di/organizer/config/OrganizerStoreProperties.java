package com.di.organizer.config;

import com.di.organizer.codec.TabularFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Location and format of the production order table (from application.yml).
 * The file is the whole collection; a missing file is an empty table.
 */
@Data
@ConfigurationProperties(prefix = "organizer.store")
public class OrganizerStoreProperties {

    /** Backing tabular file, relative to the working directory unless absolute. */
    private String file = "data/production_orders.xlsx";

    /** auto (pick by file extension), xlsx or csv. */
    private TabularFormat format = TabularFormat.AUTO;

    /** Worksheet name used when writing xlsx files. */
    private String sheetName = "Orders";

    /** When true and the backing file is absent at startup, the sample orders are written. */
    private boolean seedSampleData = false;

    public Path getFilePath() {
        if (file == null || file.isBlank()) {
            throw new IllegalStateException("organizer.store.file must not be blank");
        }
        return Path.of(file.trim());
    }
}
