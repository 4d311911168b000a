package com.di.organizer.config;

import com.di.organizer.order.ProductionOrderStore;
import com.di.organizer.order.SampleOrders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

/**
 * At startup, writes the sample production orders when organizer.store.seed-sample-data=true and
 * the backing file does not exist yet. An existing table is never touched.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class SampleDataInitializer implements ApplicationRunner {

    private final OrganizerStoreProperties storeProperties;
    private final ProductionOrderStore store;

    @Override
    public void run(ApplicationArguments args) {
        if (!storeProperties.isSeedSampleData()) {
            log.debug("[STARTUP] seed-sample-data disabled; table at {} left as is", store.getLocation());
            return;
        }
        if (Files.exists(store.getLocation())) {
            log.info("[STARTUP] Table {} already exists; skipping sample data", store.getLocation());
            return;
        }
        boolean written = store.persist(SampleOrders.create());
        if (written) {
            log.info("[STARTUP] Wrote {} sample orders to {}", SampleOrders.create().size(), store.getLocation());
        } else {
            log.error("[STARTUP] Could not write sample orders to {}", store.getLocation());
        }
    }
}
