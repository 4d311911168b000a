package com.di.organizer.config;

import com.di.organizer.codec.TabularCodec;
import com.di.organizer.codec.TabularCodecs;
import com.di.organizer.order.ProductionOrderNormalizer;
import com.di.organizer.order.ProductionOrderStore;
import com.di.organizer.order.TabularFileProductionOrderStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the production order store to the configured backing file. The path is passed to the
 * store's constructor so several independent stores can coexist (tests, tools).
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public TabularCodec tabularCodec(OrganizerStoreProperties properties) {
        Path file = properties.getFilePath();
        TabularCodec codec = TabularCodecs.forPath(file, properties.getFormat(), properties.getSheetName());
        log.info("[STORE-CONFIG] file={} format={} codec={}", file.toAbsolutePath(), properties.getFormat(),
                codec.getClass().getSimpleName());
        return codec;
    }

    @Bean
    public ProductionOrderStore productionOrderStore(OrganizerStoreProperties properties,
                                                     TabularCodec tabularCodec,
                                                     ProductionOrderNormalizer normalizer) {
        return new TabularFileProductionOrderStore(properties.getFilePath(), tabularCodec, normalizer);
    }
}
