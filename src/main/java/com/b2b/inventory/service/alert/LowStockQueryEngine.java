package com.b2b.inventory.service.alert;

import com.b2b.inventory.model.AlertRow;
import com.b2b.inventory.model.LowStockCandidate;
import com.b2b.inventory.model.SalesVelocity;
import com.b2b.inventory.repository.LowStockRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects actionable low-stock rows for a company.
 *
 * A row qualifies when all of these hold:
 * - its warehouse belongs to the company
 * - quantity is below the product threshold (fallback when the threshold is missing)
 * - it has recent sales, i.e. a present and strictly positive units-sold value
 *
 * Understocked rows without recent sales are not reported.
 */
@Service
@Slf4j
public class LowStockQueryEngine {

    private final WarehouseDirectory warehouseDirectory;
    private final LowStockRepository lowStockRepository;
    private final SalesVelocityAggregator salesVelocityAggregator;
    private final int thresholdFallback;

    public LowStockQueryEngine(WarehouseDirectory warehouseDirectory,
                               LowStockRepository lowStockRepository,
                               SalesVelocityAggregator salesVelocityAggregator,
                               @Value("${app.alerts.threshold-fallback:1}") int thresholdFallback) {
        this.warehouseDirectory = warehouseDirectory;
        this.lowStockRepository = lowStockRepository;
        this.salesVelocityAggregator = salesVelocityAggregator;
        this.thresholdFallback = thresholdFallback;
    }

    /**
     * One row per (product, warehouse), ordered by product id then warehouse id.
     */
    public List<AlertRow> findLowStockAlerts(long companyId, int windowDays) {
        Set<Long> warehouseIds = warehouseDirectory.warehouseIdsOf(companyId);
        if (warehouseIds.isEmpty()) {
            log.info("Company {} has no warehouses, no alerts to compute", companyId);
            return List.of();
        }

        List<LowStockCandidate> candidates = lowStockRepository.findLowStockCandidates(warehouseIds, thresholdFallback);
        if (candidates.isEmpty()) {
            log.debug("Company {}: no inventory below threshold in {} warehouses", companyId, warehouseIds.size());
            return List.of();
        }

        Map<Long, SalesVelocity> velocities = salesVelocityAggregator.computeAvgDailySales(
                candidates.stream().map(LowStockCandidate::inventoryId).toList(), windowDays);

        List<AlertRow> rows = new ArrayList<>();
        for (LowStockCandidate candidate : candidates) {
            SalesVelocity velocity = velocities.get(candidate.inventoryId());
            if (velocity != null && velocity.hasSales()) {
                rows.add(new AlertRow(candidate, velocity));
            }
        }

        log.debug("Company {}: {} understocked rows, {} with recent sales", companyId, candidates.size(), rows.size());
        return rows;
    }
}
