package com.b2b.inventory.service.alert;

import com.b2b.inventory.config.AppMetrics;
import com.b2b.inventory.model.Warehouse;
import com.b2b.inventory.repository.WarehouseRepository;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Company → warehouse ids, cache-aside over the warehouses table.
 */
@Service
@Slf4j
public class WarehouseDirectory {

    private final WarehouseRepository warehouseRepository;
    private final Cache<Long, Set<Long>> companyWarehouseCache;
    private final AppMetrics metrics;

    public WarehouseDirectory(WarehouseRepository warehouseRepository,
                              Cache<Long, Set<Long>> companyWarehouseCache,
                              AppMetrics metrics) {
        this.warehouseRepository = warehouseRepository;
        this.companyWarehouseCache = companyWarehouseCache;
        this.metrics = metrics;
    }

    public Set<Long> warehouseIdsOf(long companyId) {
        Set<Long> cached = companyWarehouseCache.getIfPresent(companyId);
        if (cached != null) {
            metrics.incrementWarehouseCacheHits();
            log.debug("Warehouse cache HIT: company {}", companyId);
            return cached;
        }

        metrics.incrementWarehouseCacheMisses();
        log.debug("Warehouse cache MISS: company {}", companyId);

        Set<Long> ids = warehouseRepository.findByCompanyId(companyId).stream()
                .map(Warehouse::id)
                .collect(Collectors.toUnmodifiableSet());

        // Empty sets are not cached, so a newly provisioned company shows up immediately
        if (!ids.isEmpty()) {
            companyWarehouseCache.put(companyId, ids);
        }
        return ids;
    }

    public void invalidate(long companyId) {
        companyWarehouseCache.invalidate(companyId);
        log.info("Invalidated warehouse cache: company {}", companyId);
    }
}
