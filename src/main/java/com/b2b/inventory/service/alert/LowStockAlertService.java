package com.b2b.inventory.service.alert;

import com.b2b.inventory.config.AppMetrics;
import com.b2b.inventory.model.AlertRow;
import com.b2b.inventory.model.LowStockAlert;
import com.b2b.inventory.model.LowStockAlertReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read path: query engine, then assembler. Read-only, so a failure has nothing to undo.
 */
@Service
@Slf4j
public class LowStockAlertService {

    private final LowStockQueryEngine queryEngine;
    private final AlertAssembler assembler;
    private final AppMetrics metrics;
    private final int defaultWindowDays;

    public LowStockAlertService(LowStockQueryEngine queryEngine,
                                AlertAssembler assembler,
                                AppMetrics metrics,
                                @Value("${app.alerts.sales-window-days:30}") int defaultWindowDays) {
        if (defaultWindowDays < 1) {
            throw new IllegalArgumentException("app.alerts.sales-window-days must be at least 1: " + defaultWindowDays);
        }
        this.queryEngine = queryEngine;
        this.assembler = assembler;
        this.metrics = metrics;
        this.defaultWindowDays = defaultWindowDays;
        log.info("LowStockAlertService initialized with sales window of {} days", defaultWindowDays);
    }

    public LowStockAlertReport getLowStockAlerts(long companyId) {
        return getLowStockAlerts(companyId, defaultWindowDays);
    }

    public LowStockAlertReport getLowStockAlerts(long companyId, int windowDays) {
        long startTime = System.currentTimeMillis();

        List<AlertRow> rows = queryEngine.findLowStockAlerts(companyId, windowDays);
        List<LowStockAlert> alerts = rows.stream()
                .map(assembler::assemble)
                .toList();

        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordAlertQueryTime(elapsed);
        metrics.incrementAlertsGenerated(alerts.size());
        log.info("Computed {} low-stock alerts for company {} (window={}d) in {}ms",
                alerts.size(), companyId, windowDays, elapsed);

        return LowStockAlertReport.of(alerts);
    }

    public int getDefaultWindowDays() {
        return defaultWindowDays;
    }
}
