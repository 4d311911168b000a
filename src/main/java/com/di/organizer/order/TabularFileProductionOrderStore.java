package com.di.organizer.order;

import com.di.organizer.codec.TabularCodec;
import com.di.organizer.util.ValueCoercion;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ProductionOrderStore} over a single table file read and written through a {@link TabularCodec}.
 * Every operation is a full read-modify-write of the file.
 */
@Slf4j
public class TabularFileProductionOrderStore implements ProductionOrderStore {

    private final Path file;
    private final TabularCodec codec;
    private final ProductionOrderNormalizer normalizer;

    public TabularFileProductionOrderStore(Path file, TabularCodec codec, ProductionOrderNormalizer normalizer) {
        this.file = Objects.requireNonNull(file, "file");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    @Override
    public Path getLocation() {
        return file;
    }

    @Override
    public List<ProductionOrder> load() {
        if (!Files.exists(file)) {
            log.warn("[STORE] {} does not exist; returning empty table", file);
            return new ArrayList<>();
        }
        try {
            List<ProductionOrder> orders = PriorityRanking.rank(normalizer.clean(codec.read(file)));
            log.info("[STORE] Read {} production orders from {}", orders.size(), file);
            return orders;
        } catch (IOException | RuntimeException e) {
            // Unreadable and empty look the same to callers; the log is the only difference.
            log.error("[STORE] Failed to read {}: {}", file, e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    @Override
    public boolean persist(List<? extends Map<String, ?>> rows) {
        if (rows == null) {
            log.error("[STORE] Refusing to write a null row list to {}", file);
            return false;
        }
        try {
            List<ProductionOrder> ranked = PriorityRanking.rank(normalizer.clean(rows));
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            codec.write(file, OrderColumn.headers(), toRows(ranked));
            log.info("[STORE] Wrote {} production orders to {}", ranked.size(), file);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("[STORE] Failed to write {}: {}", file, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public boolean insert(Map<String, ?> candidate) {
        if (candidate == null) {
            log.error("[STORE] Cannot insert a null production order");
            return false;
        }
        List<ProductionOrder> existing = load();
        int total = existing.size();
        int desired = ValueCoercion.tryParseInt(candidate.get(OrderColumn.PRIORITY.getHeader()))
                .orElse(total + 1);
        desired = Math.max(1, Math.min(desired, total + 1));

        int insertAt = desired - 1;
        List<Map<String, Object>> spliced = new ArrayList<>(total + 1);
        spliced.addAll(toRows(existing.subList(0, insertAt)));
        spliced.add(new LinkedHashMap<>(candidate));
        spliced.addAll(toRows(existing.subList(insertAt, total)));

        // position is authoritative here: the candidate already sits at its rank
        for (int i = 0; i < spliced.size(); i++) {
            spliced.get(i).put(OrderColumn.PRIORITY.getHeader(), i + 1);
        }
        log.debug("[STORE] Inserting order '{}' at rank {} of {}",
                candidate.get(OrderColumn.PRODUCTION_ORDER.getHeader()), desired, total + 1);
        return persist(spliced);
    }

    @Override
    public boolean replaceAt(int index, Map<String, ?> record) {
        if (record == null) {
            log.error("[STORE] Cannot replace order {} with null", index);
            return false;
        }
        List<ProductionOrder> existing = load();
        if (!inRange(index, existing.size())) {
            log.error("[STORE] Order index {} out of range (size {})", index, existing.size());
            return false;
        }
        List<Map<String, Object>> rows = toRows(existing);
        rows.set(index, new LinkedHashMap<>(record));
        return persist(rows);
    }

    @Override
    public boolean removeAt(int index) {
        List<ProductionOrder> existing = load();
        if (!inRange(index, existing.size())) {
            log.error("[STORE] Order index {} out of range (size {})", index, existing.size());
            return false;
        }
        List<Map<String, Object>> rows = toRows(existing);
        rows.remove(index);
        return persist(rows);
    }

    @Override
    public boolean removeByKey(String productionOrder) {
        String target = productionOrder == null ? "" : productionOrder.trim();
        List<ProductionOrder> existing = load();
        for (int i = 0; i < existing.size(); i++) {
            if (existing.get(i).getProductionOrder().trim().equals(target)) {
                List<Map<String, Object>> rows = toRows(existing);
                rows.remove(i);
                return persist(rows);
            }
        }
        log.warn("[STORE] Production order '{}' not found", target);
        return false;
    }

    @Override
    public BatchRemovalResult removeBatchByKeys(Collection<String> productionOrders) {
        Set<String> targets = new LinkedHashSet<>();
        if (productionOrders != null) {
            for (String key : productionOrders) {
                if (key != null && !key.trim().isEmpty()) {
                    targets.add(key.trim());
                }
            }
        }
        if (targets.isEmpty()) {
            log.warn("[STORE] Batch removal requested with no production order numbers");
            return BatchRemovalResult.nothingRequested();
        }

        List<ProductionOrder> existing = load();
        List<ProductionOrder> kept = new ArrayList<>(existing.size());
        int removed = 0;
        for (ProductionOrder order : existing) {
            if (targets.contains(order.getProductionOrder().trim())) {
                removed++;
            } else {
                kept.add(order);
            }
        }
        boolean written = persist(toRows(kept));
        log.info("[STORE] Batch removal: removed {} of {} requested order numbers", removed, targets.size());
        return new BatchRemovalResult(written && removed > 0, removed, targets.size());
    }

    private static boolean inRange(int index, int size) {
        return index >= 0 && index < size;
    }

    private static List<Map<String, Object>> toRows(List<ProductionOrder> orders) {
        List<Map<String, Object>> rows = new ArrayList<>(orders.size());
        for (ProductionOrder order : orders) {
            rows.add(order.toRow());
        }
        return rows;
    }
}
