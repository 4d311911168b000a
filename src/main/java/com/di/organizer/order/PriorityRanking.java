package com.di.organizer.order;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dense ranking of a production order collection.
 * <p>
 * After {@link #rank} the list is ordered by ascending priority (equal priorities keep their input
 * order) and priorities are exactly 1..N.
 */
public final class PriorityRanking {

    private PriorityRanking() {
    }

    /**
     * Stable sort by priority, then renumber 1..N. The input list is not modified.
     */
    public static List<ProductionOrder> rank(List<ProductionOrder> orders) {
        List<ProductionOrder> sorted = new ArrayList<>(orders);
        // List.sort is a stable merge sort
        sorted.sort(Comparator.comparingInt(ProductionOrder::getPriority));
        return renumber(sorted);
    }

    /**
     * Renumber 1..N by list position, without reordering.
     */
    public static List<ProductionOrder> renumber(List<ProductionOrder> orders) {
        List<ProductionOrder> out = new ArrayList<>(orders.size());
        for (int i = 0; i < orders.size(); i++) {
            out.add(orders.get(i).withPriority(i + 1));
        }
        return out;
    }
}
