package com.di.organizer.order;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the production order table after normalization. Text and date fields are never null
 * (empty string when unknown); dates are {@code yyyy-MM-dd}. JSON property names match the table
 * headers.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"Priority", "Status", "Production_order", "Part_type",
        "Pieces_finished", "Pieces_intended", "Delivery_date", "Scheduled_date"})
public class ProductionOrder {

    /** Dense 1-based rank once the collection has been ranked; the raw sort key before that. */
    @JsonProperty("Priority")
    int priority;

    @NonNull
    @JsonProperty("Status")
    String status;

    /** Business key. Expected to be unique; not enforced. */
    @NonNull
    @JsonProperty("Production_order")
    String productionOrder;

    @NonNull
    @JsonProperty("Part_type")
    String partType;

    @JsonProperty("Pieces_finished")
    int piecesFinished;

    @JsonProperty("Pieces_intended")
    int piecesIntended;

    @NonNull
    @JsonProperty("Delivery_date")
    String deliveryDate;

    @NonNull
    @JsonProperty("Scheduled_date")
    String scheduledDate;

    public ProductionOrder withPriority(int newPriority) {
        return newPriority == priority ? this : toBuilder().priority(newPriority).build();
    }

    /** Row map keyed by table header, in column order. */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(OrderColumn.PRIORITY.getHeader(), priority);
        row.put(OrderColumn.STATUS.getHeader(), status);
        row.put(OrderColumn.PRODUCTION_ORDER.getHeader(), productionOrder);
        row.put(OrderColumn.PART_TYPE.getHeader(), partType);
        row.put(OrderColumn.PIECES_FINISHED.getHeader(), piecesFinished);
        row.put(OrderColumn.PIECES_INTENDED.getHeader(), piecesIntended);
        row.put(OrderColumn.DELIVERY_DATE.getHeader(), deliveryDate);
        row.put(OrderColumn.SCHEDULED_DATE.getHeader(), scheduledDate);
        return row;
    }
}
