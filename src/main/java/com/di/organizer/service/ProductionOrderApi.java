package com.di.organizer.service;

import com.di.organizer.controller.dto.OrderResponse;
import com.di.organizer.order.BatchRemovalResult;
import com.di.organizer.order.ProductionOrder;
import com.di.organizer.order.ProductionOrderJsonExchange;
import com.di.organizer.order.ProductionOrderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Translates API calls into store calls and store outcomes into {@link OrderResponse} envelopes.
 * HTTP status mapping is left to the controller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductionOrderApi {

    private final ProductionOrderStore store;
    private final ProductionOrderJsonExchange exchange;

    public OrderResponse health() {
        return OrderResponse.builder()
                .status(OrderResponse.HEALTHY)
                .message("Production order API is running")
                .timestamp(now())
                .build();
    }

    public OrderResponse list() {
        List<ProductionOrder> orders = store.load();
        return OrderResponse.builder()
                .status(OrderResponse.SUCCESS)
                .data(orders)
                .count(orders.size())
                .timestamp(now())
                .build();
    }

    public OrderResponse create(Map<String, Object> fields) {
        boolean ok = store.insert(fields);
        return outcome(ok, "Order created", "Failed to create order");
    }

    public OrderResponse replace(int index, Map<String, Object> fields) {
        boolean ok = store.replaceAt(index, fields);
        return outcome(ok, "Order updated", "Failed to update order " + index);
    }

    public OrderResponse remove(int index) {
        boolean ok = store.removeAt(index);
        return outcome(ok, "Order deleted", "Failed to delete order " + index);
    }

    public OrderResponse removeByOrderNumber(String productionOrder) {
        boolean ok = store.removeByKey(productionOrder);
        return outcome(ok, "Order deleted", "Production order not found or delete failed");
    }

    public OrderResponse removeManyByOrderNumbers(List<String> productionOrders) {
        BatchRemovalResult result = store.removeBatchByKeys(productionOrders);
        return OrderResponse.builder()
                .status(result.isSuccess() ? OrderResponse.SUCCESS : OrderResponse.ERROR)
                .message(result.isSuccess()
                        ? "Deleted " + result.getRemoved() + " orders"
                        : "Batch delete failed or no orders found")
                .success(result.isSuccess())
                .removed(result.getRemoved())
                .requested(result.getRequested())
                .timestamp(now())
                .build();
    }

    public String exportDocument() {
        return exchange.exportAll();
    }

    public OrderResponse importDocument(String document) {
        boolean ok = exchange.importAll(document);
        return outcome(ok, "Orders imported", "Order import failed");
    }

    /**
     * Uploaded tables are accepted and acknowledged but not applied to the store yet.
     */
    public OrderResponse acknowledgeUpload(String filename, long size) {
        log.info("[UPLOAD] Received {} ({} bytes); upload is acknowledged only, table unchanged", filename, size);
        return OrderResponse.builder()
                .status(OrderResponse.INFO)
                .message("File accepted but not applied; table upload is not enabled yet")
                .filename(filename)
                .size(size)
                .timestamp(now())
                .build();
    }

    private OrderResponse outcome(boolean ok, String successMessage, String failureMessage) {
        return OrderResponse.builder()
                .status(ok ? OrderResponse.SUCCESS : OrderResponse.ERROR)
                .message(ok ? successMessage : failureMessage)
                .success(ok)
                .timestamp(now())
                .build();
    }

    private String now() {
        return Instant.now().toString();
    }
}
