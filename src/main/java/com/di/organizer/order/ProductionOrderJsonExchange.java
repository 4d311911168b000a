package com.di.organizer.order;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * JSON export and import of the whole production order table. The document is a JSON array of
 * objects keyed by table header.
 */
@Component
@Slf4j
public class ProductionOrderJsonExchange {

    static final String EMPTY_DOCUMENT = "[]";

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final ProductionOrderStore store;
    private final ObjectMapper objectMapper;

    public ProductionOrderJsonExchange(ProductionOrderStore store) {
        this.store        = store;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serializes the current table. Never fails: any error yields {@code "[]"}.
     */
    public String exportAll() {
        try {
            return objectMapper.writeValueAsString(store.load());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[EXPORT] Failed to serialize production orders: {}", e.getMessage(), e);
            return EMPTY_DOCUMENT;
        }
    }

    /**
     * Replaces the table with the rows of {@code document}. A document that is not a JSON array of
     * objects is rejected before anything is written.
     *
     * @return false for a malformed document or a failed write
     */
    public boolean importAll(String document) {
        if (document == null || document.isBlank()) {
            log.error("[IMPORT] Empty import document");
            return false;
        }
        List<Map<String, Object>> rows;
        try {
            rows = objectMapper.readValue(document, ROWS);
        } catch (JsonProcessingException e) {
            log.error("[IMPORT] Malformed import document: {}", e.getOriginalMessage());
            return false;
        }
        if (rows == null) {
            log.error("[IMPORT] Import document is null");
            return false;
        }
        log.info("[IMPORT] Importing {} rows", rows.size());
        return store.persist(rows);
    }
}
