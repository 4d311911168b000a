package com.di.organizer.order;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The three demo orders shipped with the organizer table. Their priorities (50, 10, 11) are
 * deliberately out of order so the ranking is visible after the first write.
 */
public final class SampleOrders {

    private SampleOrders() {
    }

    public static List<Map<String, Object>> create() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row(50, "Active", "FA_401001_R2017", "4_318220", 2, 50, "2017-09-26", "2018-09-26"));
        rows.add(row(10, "Active", "FA_401002_R2017", "4_312000_WSG1", 0, 60, "2017-10-04", "2018-10-04"));
        rows.add(row(11, "Active", "FA_401003_R2016", "4_313000_WSG2", 0, 100, "2017-10-02", "2018-10-02"));
        return rows;
    }

    static Map<String, Object> row(int priority, String status, String productionOrder, String partType,
                                   int finished, int intended, String deliveryDate, String scheduledDate) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(OrderColumn.PRIORITY.getHeader(), priority);
        row.put(OrderColumn.STATUS.getHeader(), status);
        row.put(OrderColumn.PRODUCTION_ORDER.getHeader(), productionOrder);
        row.put(OrderColumn.PART_TYPE.getHeader(), partType);
        row.put(OrderColumn.PIECES_FINISHED.getHeader(), finished);
        row.put(OrderColumn.PIECES_INTENDED.getHeader(), intended);
        row.put(OrderColumn.DELIVERY_DATE.getHeader(), deliveryDate);
        row.put(OrderColumn.SCHEDULED_DATE.getHeader(), scheduledDate);
        return row;
    }
}
