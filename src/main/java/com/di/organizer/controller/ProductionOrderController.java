package com.di.organizer.controller;

import com.di.organizer.config.UploadProperties;
import com.di.organizer.controller.dto.BatchDeleteRequest;
import com.di.organizer.controller.dto.ImportRequest;
import com.di.organizer.controller.dto.OrderDataRequest;
import com.di.organizer.controller.dto.OrderResponse;
import com.di.organizer.service.ProductionOrderApi;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.Instant;

/**
 * REST API for the production order table.
 * <p>
 * Store failures (index out of range, unknown order number, failed write) are 400 with an
 * {@code error} envelope; unexpected exceptions are 500 via
 * {@link com.di.organizer.exception.GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin
@RequiredArgsConstructor
public class ProductionOrderController {

    private final ProductionOrderApi api;
    private final UploadProperties uploadProperties;

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> health() {
        return ResponseEntity.ok(api.health());
    }

    @GetMapping(value = "/orders", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> list() {
        return toEntity(api.list());
    }

    /**
     * Creates an order at the rank given by {@code data.Priority} (appended when absent).
     */
    @PostMapping(value = "/orders", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> create(@Valid @RequestBody OrderDataRequest request) {
        log.info("[ORDERS] POST create priority={}", request.getData().get("Priority"));
        return toEntity(api.create(request.getData()));
    }

    /**
     * Replaces the order at a 0-based position of the current ranked list.
     */
    @PutMapping(value = "/orders/{index}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> replace(@PathVariable("index") int index, @Valid @RequestBody OrderDataRequest request) {
        log.info("[ORDERS] PUT index={}", index);
        return toEntity(api.replace(index, request.getData()));
    }

    @DeleteMapping(value = "/orders/{index}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> remove(@PathVariable("index") int index) {
        log.info("[ORDERS] DELETE index={}", index);
        return toEntity(api.remove(index));
    }

    @DeleteMapping(value = "/orders/by-production-order/{productionOrder}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> removeByOrderNumber(@PathVariable("productionOrder") String productionOrder) {
        log.info("[ORDERS] DELETE productionOrder={}", productionOrder);
        return toEntity(api.removeByOrderNumber(productionOrder));
    }

    /**
     * Removes several orders by production order number in one read and one write.
     */
    @PostMapping(value = "/orders/batch-delete", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> removeMany(@Valid @RequestBody BatchDeleteRequest request) {
        log.info("[ORDERS] POST batch-delete count={}", request.getProductionOrders().size());
        return toEntity(api.removeManyByOrderNumbers(request.getProductionOrders()));
    }

    @GetMapping(value = "/orders/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> export() {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(api.exportDocument());
    }

    /**
     * Replaces the whole table with {@code data} (a JSON array of orders).
     */
    @PostMapping(value = "/orders/import", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> importOrders(@Valid @RequestBody ImportRequest request) {
        return toEntity(api.importDocument(request.getData().toString()));
    }

    /**
     * Accepts an xlsx table upload. The file is acknowledged but not applied to the table.
     */
    @PostMapping(value = "/orders/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OrderResponse> upload(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null) {
            return badRequest("No file uploaded");
        }
        String filename = file.getOriginalFilename();
        if (filename == null || filename.isBlank()) {
            return badRequest("File name is empty");
        }
        if (!uploadProperties.isAllowed(filename)) {
            return badRequest("Only " + uploadProperties.getAllowedExtension() + " files are supported");
        }
        return ResponseEntity.ok(api.acknowledgeUpload(filename, file.getSize()));
    }

    private static ResponseEntity<OrderResponse> toEntity(OrderResponse response) {
        HttpStatus status = response.isSuccessful() ? HttpStatus.OK : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(response);
    }

    private static ResponseEntity<OrderResponse> badRequest(String message) {
        return ResponseEntity.badRequest().body(OrderResponse.builder()
                .status(OrderResponse.ERROR)
                .message(message)
                .timestamp(Instant.now().toString())
                .build());
    }
}
