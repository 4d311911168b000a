package com.di.organizer.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the import call: {@code {"data": [ {...}, {...} ]}}. {@code data} is kept as a tree and
 * handed to the importer as a JSON document, so shape errors are reported by the importer.
 */
@Data
@NoArgsConstructor
public class ImportRequest {

    @NotNull(message = "request body must contain 'data'")
    private JsonNode data;
}
