package com.b2b.inventory.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Set;

/**
 * Caffeine caches for read-only reference data.
 *
 * COMPANY WAREHOUSE CACHE - company id → warehouse ids
 *    - Warehouses are provisioned outside this service and change rarely
 *    - The alert path tolerates slightly stale data
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.warehouse.max-size:1000}")
    private int warehouseMaxSize;

    @Value("${app.cache.warehouse.ttl-minutes:5}")
    private int warehouseTtlMinutes;

    @Bean
    public Cache<Long, Set<Long>> companyWarehouseCache() {
        log.info("Creating company warehouse cache: maxSize={}, ttl={}m", warehouseMaxSize, warehouseTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(warehouseMaxSize)
                .expireAfterWrite(Duration.ofMinutes(warehouseTtlMinutes))
                .recordStats()
                .build();
    }
}
