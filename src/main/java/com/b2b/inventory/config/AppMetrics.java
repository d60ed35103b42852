package com.b2b.inventory.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Application metrics for the write and alert paths.
 *
 * Key metrics (see /actuator/metrics):
 * - product.create.time         → end-to-end product creation
 * - product.created             → products committed
 * - product.create.conflict     → duplicate SKU rejections
 * - product.create.rejected     → validation and constraint rejections
 * - product.create.failed       → unexpected failures (rolled back)
 * - alert.query.time            → low-stock report computation
 * - alert.sales.fetch           → ledger reads for sales velocity
 * - alert.generated             → alerts returned
 * - alert.threshold.fallback    → alerts built with the fallback threshold
 */
@Component
@Getter
public class AppMetrics {

    private final Timer productCreateTimer;
    private final Timer alertQueryTimer;
    private final Timer salesFetchTimer;

    private final Counter productsCreatedCounter;
    private final Counter productConflictsCounter;
    private final Counter productRejectionsCounter;
    private final Counter productFailuresCounter;
    private final Counter alertsGeneratedCounter;
    private final Counter thresholdFallbackCounter;
    private final Counter warehouseCacheHitsCounter;
    private final Counter warehouseCacheMissesCounter;

    public AppMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS
        // ═══════════════════════════════════════════════════════════════

        this.productCreateTimer = Timer.builder("product.create.time")
                .description("Product and inventory creation, including the transaction")
                .register(registry);

        this.alertQueryTimer = Timer.builder("alert.query.time")
                .description("Low-stock alert report computation")
                .register(registry);

        this.salesFetchTimer = Timer.builder("alert.sales.fetch")
                .description("Sales ledger reads for velocity aggregation")
                .tag("table", "inventory_changes")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS
        // ═══════════════════════════════════════════════════════════════

        this.productsCreatedCounter = Counter.builder("product.created")
                .description("Products committed with their inventory")
                .register(registry);

        this.productConflictsCounter = Counter.builder("product.create.conflict")
                .description("Creations rejected for a duplicate SKU")
                .register(registry);

        this.productRejectionsCounter = Counter.builder("product.create.rejected")
                .description("Creations rejected by validation or store constraints")
                .register(registry);

        this.productFailuresCounter = Counter.builder("product.create.failed")
                .description("Creations failed unexpectedly and rolled back")
                .register(registry);

        this.alertsGeneratedCounter = Counter.builder("alert.generated")
                .description("Low-stock alerts returned")
                .register(registry);

        this.thresholdFallbackCounter = Counter.builder("alert.threshold.fallback")
                .description("Alerts computed with the fallback threshold (stored threshold missing)")
                .register(registry);

        this.warehouseCacheHitsCounter = Counter.builder("warehouse.cache.hits")
                .description("Company warehouse lookups served from cache")
                .register(registry);

        this.warehouseCacheMissesCounter = Counter.builder("warehouse.cache.misses")
                .description("Company warehouse lookups loaded from the database")
                .register(registry);
    }

    public void recordProductCreateTime(long millis) {
        productCreateTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordAlertQueryTime(long millis) {
        alertQueryTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordSalesFetchTime(long millis) {
        salesFetchTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementProductsCreated() {
        productsCreatedCounter.increment();
    }

    public void incrementProductConflicts() {
        productConflictsCounter.increment();
    }

    public void incrementProductRejections() {
        productRejectionsCounter.increment();
    }

    public void incrementProductFailures() {
        productFailuresCounter.increment();
    }

    public void incrementAlertsGenerated(int count) {
        alertsGeneratedCounter.increment(count);
    }

    public void incrementThresholdFallbacks() {
        thresholdFallbackCounter.increment();
    }

    public void incrementWarehouseCacheHits() {
        warehouseCacheHitsCounter.increment();
    }

    public void incrementWarehouseCacheMisses() {
        warehouseCacheMissesCounter.increment();
    }
}
