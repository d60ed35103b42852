package com.b2b.inventory.controller;

import com.b2b.inventory.config.AppMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Compact view of the service metrics.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("products", getProductMetrics());
        response.put("alerts", getAlertMetrics());
        response.put("timing", getTimingMetrics());

        return response;
    }

    @GetMapping("/products")
    public Map<String, Object> getProductMetrics() {
        Map<String, Object> products = new LinkedHashMap<>();

        long created = (long) appMetrics.getProductsCreatedCounter().count();
        long conflicts = (long) appMetrics.getProductConflictsCounter().count();
        long rejected = (long) appMetrics.getProductRejectionsCounter().count();
        long failed = (long) appMetrics.getProductFailuresCounter().count();
        long attempts = created + conflicts + rejected + failed;

        products.put("created", created);
        products.put("conflicts", conflicts);
        products.put("rejected", rejected);
        products.put("failed", failed);

        if (attempts > 0) {
            products.put("success_rate", String.format("%.2f%%", (created * 100.0) / attempts));
        } else {
            products.put("success_rate", "N/A");
        }

        return products;
    }

    @GetMapping("/alerts")
    public Map<String, Object> getAlertMetrics() {
        Map<String, Object> alerts = new LinkedHashMap<>();

        alerts.put("reports", appMetrics.getAlertQueryTimer().count());
        alerts.put("alerts_generated", (long) appMetrics.getAlertsGeneratedCounter().count());
        alerts.put("threshold_fallbacks", (long) appMetrics.getThresholdFallbackCounter().count());
        alerts.put("warehouse_cache_hits", (long) appMetrics.getWarehouseCacheHitsCounter().count());
        alerts.put("warehouse_cache_misses", (long) appMetrics.getWarehouseCacheMissesCounter().count());

        return alerts;
    }

    @GetMapping("/timing")
    public Map<String, Object> getTimingMetrics() {
        Map<String, Object> timing = new LinkedHashMap<>();

        timing.put("product_create", getTimerStats(appMetrics.getProductCreateTimer()));
        timing.put("alert_query", getTimerStats(appMetrics.getAlertQueryTimer()));
        timing.put("sales_fetch", getTimerStats(appMetrics.getSalesFetchTimer()));

        return timing;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("total_time_ms", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avg_time_ms", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("max_time_ms", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("total_time_ms", "0.00");
            stats.put("avg_time_ms", "N/A");
            stats.put("max_time_ms", "N/A");
        }

        return stats;
    }
}
