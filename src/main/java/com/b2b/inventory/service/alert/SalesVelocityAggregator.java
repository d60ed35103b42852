package com.b2b.inventory.service.alert;

import com.b2b.inventory.config.AppMetrics;
import com.b2b.inventory.model.InventoryChange;
import com.b2b.inventory.model.SalesVelocity;
import com.b2b.inventory.repository.SalesLedgerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Average daily sales per inventory row over a trailing window, from the sale entries of the ledger.
 *
 * Units sold are the magnitudes of negative sale deltas. The average divides by the full
 * window length even when sales happened on only a few of its days, which dilutes bursts.
 * Rows without any sale entry in the window are absent from the result.
 */
@Service
@Slf4j
public class SalesVelocityAggregator {

    private final SalesLedgerRepository ledgerRepository;
    private final AppMetrics metrics;
    private final Clock clock;

    public SalesVelocityAggregator(SalesLedgerRepository ledgerRepository, AppMetrics metrics, Clock clock) {
        this.ledgerRepository = ledgerRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Map<Long, SalesVelocity> computeAvgDailySales(Collection<Long> inventoryIds, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1: " + windowDays);
        }
        if (inventoryIds.isEmpty()) {
            return Map.of();
        }

        LocalDateTime since = LocalDateTime.now(clock).minusDays(windowDays);

        long startTime = System.currentTimeMillis();
        Collection<InventoryChange> sales = ledgerRepository.findSaleEntriesSince(inventoryIds, since);
        metrics.recordSalesFetchTime(System.currentTimeMillis() - startTime);

        Map<Long, Long> unitsSold = new HashMap<>();
        for (InventoryChange sale : sales) {
            unitsSold.merge(sale.inventoryId(), (long) sale.unitsOut(), Long::sum);
        }

        Map<Long, SalesVelocity> result = new HashMap<>();
        unitsSold.forEach((inventoryId, units) ->
                result.put(inventoryId, new SalesVelocity(inventoryId, units, windowDays)));

        log.debug("Sales velocity for {} of {} inventory rows since {} ({} ledger entries)",
                result.size(), inventoryIds.size(), since, sales.size());
        return result;
    }
}
