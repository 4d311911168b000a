package com.di.organizer.order;

import com.di.organizer.util.DateFormatUtils;
import com.di.organizer.util.ValueCoercion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coerces loosely typed rows (decoded table cells, JSON request bodies) into {@link ProductionOrder}s.
 * <ul>
 *   <li>Columns missing from a row take their default (0 or empty string) first.</li>
 *   <li>Priority and piece counts: lenient numeric coercion, non-numeric → 0, fractions truncate.
 *       Piece counts below zero become 0.</li>
 *   <li>Delivery and scheduled dates: parsed and rewritten as {@code yyyy-MM-dd}; unparsable → "".</li>
 *   <li>Other columns: text, null → "".</li>
 *   <li>Columns outside the fixed set are dropped.</li>
 * </ul>
 * Normalizing already-normalized rows returns them unchanged. Nothing here throws on bad data.
 */
@Slf4j
@Component
public class ProductionOrderNormalizer {

    public List<ProductionOrder> clean(List<? extends Map<String, ?>> rows) {
        if (rows == null || rows.isEmpty()) {
            return new ArrayList<>();
        }
        List<ProductionOrder> out = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            out.add(clean(row));
        }
        return out;
    }

    public ProductionOrder clean(Map<String, ?> row) {
        Map<String, Object> full = reindex(row);
        return ProductionOrder.builder()
                .priority(ValueCoercion.toInt(full.get(OrderColumn.PRIORITY.getHeader())))
                .status(ValueCoercion.toText(full.get(OrderColumn.STATUS.getHeader())))
                .productionOrder(ValueCoercion.toText(full.get(OrderColumn.PRODUCTION_ORDER.getHeader())))
                .partType(ValueCoercion.toText(full.get(OrderColumn.PART_TYPE.getHeader())))
                .piecesFinished(pieces(full.get(OrderColumn.PIECES_FINISHED.getHeader())))
                .piecesIntended(pieces(full.get(OrderColumn.PIECES_INTENDED.getHeader())))
                .deliveryDate(DateFormatUtils.toIsoDateString(full.get(OrderColumn.DELIVERY_DATE.getHeader())))
                .scheduledDate(DateFormatUtils.toIsoDateString(full.get(OrderColumn.SCHEDULED_DATE.getHeader())))
                .build();
    }

    /**
     * Restricts a row to the fixed column set in column order; absent or null entries get the
     * column default. Unknown keys are dropped.
     */
    public Map<String, Object> reindex(Map<String, ?> row) {
        Map<String, ?> source = row == null ? Collections.emptyMap() : row;
        Map<String, Object> out = new LinkedHashMap<>();
        for (OrderColumn column : OrderColumn.values()) {
            Object value = source.get(column.getHeader());
            out.put(column.getHeader(), value == null ? column.defaultValue() : value);
        }
        if (log.isTraceEnabled() && source.size() > out.size()) {
            log.trace("Dropped unknown columns {}", source.keySet());
        }
        return out;
    }

    private static int pieces(Object value) {
        return Math.max(0, ValueCoercion.toInt(value));
    }
}
