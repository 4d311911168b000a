package com.di.organizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Validation rules for the table upload endpoint.
 */
@Data
@ConfigurationProperties(prefix = "organizer.upload")
public class UploadProperties {

    /** Only file names ending with this suffix are accepted (case-insensitive). */
    private String allowedExtension = ".xlsx";

    public boolean isAllowed(String filename) {
        if (filename == null || filename.isBlank()) return false;
        String suffix = allowedExtension == null ? "" : allowedExtension.trim().toLowerCase();
        return filename.trim().toLowerCase().endsWith(suffix);
    }
}
