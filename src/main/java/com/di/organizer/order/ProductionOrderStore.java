package com.di.organizer.order;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Owner of the production order table. Every persisted state is densely ranked: stored order is
 * ascending priority and priorities are exactly 1..N.
 * <p>
 * Each call reads the whole table and each mutation rewrites it; there is no cache and no locking.
 * Callers must serialize mutating calls themselves, otherwise the later write wins. Positional
 * indexes refer to the ranked order read inside the same call and are not stable across calls.
 * <p>
 * No operation throws for missing records, unreadable files or failed writes; they report
 * {@code false} (or an empty list) and log the cause.
 */
public interface ProductionOrderStore {

    /**
     * Reads the table, normalized and ranked. Does not write back.
     *
     * @return the orders in rank order; empty when the file is absent or cannot be decoded
     */
    List<ProductionOrder> load();

    /**
     * Normalizes, ranks and writes the given rows as the whole table. Supplied priorities are only
     * a sort key; the stored priorities are re-derived. Creates the directory when needed.
     *
     * @param rows loosely typed rows keyed by table header
     * @return false when encoding or writing fails
     */
    boolean persist(List<? extends Map<String, ?>> rows);

    /**
     * Inserts at the rank given by the candidate's Priority (clamped to 1..N+1, appended when absent
     * or not an integer); orders at or after that rank move one place down.
     */
    boolean insert(Map<String, ?> candidate);

    /**
     * Replaces the order at {@code index} with {@code record} as given; its Priority takes part in
     * the re-ranking like any other row.
     *
     * @return false when {@code index} is outside 0..N-1 (nothing written) or the write fails
     */
    boolean replaceAt(int index, Map<String, ?> record);

    /**
     * Removes the order at {@code index}; the rest is re-ranked.
     *
     * @return false when {@code index} is outside 0..N-1 (nothing written) or the write fails
     */
    boolean removeAt(int index);

    /**
     * Removes the first order whose trimmed Production_order equals the trimmed key.
     *
     * @return false when no order matches (nothing written) or the write fails
     */
    boolean removeByKey(String productionOrder);

    /**
     * Removes every order whose Production_order is in the key set, with one read and one write.
     * Blank keys are ignored and duplicates collapse. An empty key set touches nothing.
     */
    BatchRemovalResult removeBatchByKeys(Collection<String> productionOrders);

    /** Backing file of this store. */
    Path getLocation();
}
