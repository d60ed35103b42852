package com.b2b.inventory.service.alert;

import com.b2b.inventory.config.AppMetrics;
import com.b2b.inventory.model.LowStockAlert;
import com.b2b.inventory.model.LowStockAlertReport;
import com.b2b.inventory.repository.LowStockRepository;
import com.b2b.inventory.repository.ReadRetryPolicy;
import com.b2b.inventory.repository.SalesLedgerRepository;
import com.b2b.inventory.repository.WarehouseRepository;
import com.b2b.inventory.support.InventoryTestDatabase;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full read path over H2: repositories, aggregator, engine and assembler wired by hand.
 */
class LowStockAlertServiceIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    private InventoryTestDatabase db;
    private AppMetrics metrics;
    private LowStockAlertService service;

    private long companyId;
    private long mainWarehouse;
    private long secondWarehouse;
    private long supplierId;

    @BeforeEach
    void setUp() {
        db = new InventoryTestDatabase();
        metrics = new AppMetrics(new SimpleMeterRegistry());
        ReadRetryPolicy policy = new ReadRetryPolicy(500, 0, 1L);

        WarehouseDirectory directory = new WarehouseDirectory(
                new WarehouseRepository(db.namedJdbc(), db.sqlLoader(), policy),
                Caffeine.newBuilder().maximumSize(100).build(), metrics);
        SalesVelocityAggregator aggregator = new SalesVelocityAggregator(
                new SalesLedgerRepository(db.namedJdbc(), db.sqlLoader(), policy),
                metrics, Clock.fixed(NOW, ZoneOffset.UTC));
        LowStockQueryEngine engine = new LowStockQueryEngine(directory,
                new LowStockRepository(db.namedJdbc(), db.sqlLoader(), policy), aggregator, 1);
        service = new LowStockAlertService(engine, new AlertAssembler(1, metrics), metrics, 30);

        companyId = db.insertCompany("Acme");
        mainWarehouse = db.insertWarehouse(companyId, "Main Warehouse");
        secondWarehouse = db.insertWarehouse(companyId, "Second Warehouse");
        supplierId = db.insertSupplier("Supplier Corp", "orders@supplier.com");
    }

    @Test
    @DisplayName("Should alert with days until stockout from the 30-day average")
    void shouldReportDaysUntilStockout() {
        // Given: threshold 10, stock 5, 3 sold in the window -> 0.1/day -> 50 days
        long product = db.insertProduct("WID-001", "Widget A", 10, supplierId);
        long inv = db.insertInventory(product, mainWarehouse, 5);
        db.insertLedgerEntry(inv, "sale", -1, NOW_LOCAL.minusDays(2));
        db.insertLedgerEntry(inv, "sale", -2, NOW_LOCAL.minusDays(20));

        // When
        LowStockAlertReport report = service.getLowStockAlerts(companyId);

        // Then
        assertThat(report.totalAlerts()).isEqualTo(1);
        LowStockAlert alert = report.alerts().get(0);
        assertThat(alert.productId()).isEqualTo(product);
        assertThat(alert.sku()).isEqualTo("WID-001");
        assertThat(alert.warehouseName()).isEqualTo("Main Warehouse");
        assertThat(alert.currentStock()).isEqualTo(5);
        assertThat(alert.threshold()).isEqualTo(10);
        assertThat(alert.daysUntilStockout()).isEqualTo(50L);
        assertThat(alert.supplier().id()).isEqualTo(supplierId);
        assertThat(alert.supplier().name()).isEqualTo("Supplier Corp");
    }

    @Test
    @DisplayName("Should leave out understocked rows with no sales in the window")
    void shouldExcludeRowsWithoutRecentSales() {
        // Given
        long product = db.insertProduct("WID-002", "Dormant", 10, supplierId);
        long inv = db.insertInventory(product, mainWarehouse, 2);
        db.insertLedgerEntry(inv, "sale", -5, NOW_LOCAL.minusDays(45));
        db.insertLedgerEntry(inv, "restock", 2, NOW_LOCAL.minusDays(1));

        // When / Then
        assertThat(service.getLowStockAlerts(companyId).alerts()).isEmpty();
    }

    @Test
    @DisplayName("Should leave out rows at or above their threshold")
    void shouldExcludeSufficientStock() {
        // Given
        long product = db.insertProduct("WID-003", "Plenty", 10, supplierId);
        long inv = db.insertInventory(product, mainWarehouse, 10);
        db.insertLedgerEntry(inv, "sale", -3, NOW_LOCAL.minusDays(1));

        // When / Then
        assertThat(service.getLowStockAlerts(companyId).totalAlerts()).isZero();
    }

    @Test
    @DisplayName("Should report one alert per warehouse, ordered by warehouse")
    void shouldAlertPerWarehouse() {
        // Given
        long product = db.insertProduct("WID-004", "Spread", 10, supplierId);
        long second = db.insertInventory(product, secondWarehouse, 0);
        long main = db.insertInventory(product, mainWarehouse, 4);
        db.insertLedgerEntry(main, "sale", -6, NOW_LOCAL.minusDays(3));
        db.insertLedgerEntry(second, "sale", -1, NOW_LOCAL.minusDays(3));

        // When
        LowStockAlertReport report = service.getLowStockAlerts(companyId);

        // Then
        assertThat(report.alerts())
                .extracting(LowStockAlert::warehouseId)
                .containsExactly(mainWarehouse, secondWarehouse);
        assertThat(report.alerts().get(0).daysUntilStockout()).isEqualTo(20L);
        assertThat(report.alerts().get(1).daysUntilStockout()).isZero();
    }

    @Test
    @DisplayName("Should not alert on another company's stock")
    void shouldScopeToCompany() {
        // Given
        long other = db.insertCompany("Globex");
        long otherWarehouse = db.insertWarehouse(other, "Elsewhere");
        long product = db.insertProduct("WID-005", "Theirs", 10, supplierId);
        long inv = db.insertInventory(product, otherWarehouse, 1);
        db.insertLedgerEntry(inv, "sale", -1, NOW_LOCAL.minusDays(1));

        // When / Then
        assertThat(service.getLowStockAlerts(companyId).alerts()).isEmpty();
        assertThat(service.getLowStockAlerts(other).alerts()).hasSize(1);
    }

    @Test
    @DisplayName("Should return an empty report for an unknown company")
    void shouldReturnEmptyForUnknownCompany() {
        LowStockAlertReport report = service.getLowStockAlerts(424242L);

        assertThat(report.alerts()).isEmpty();
        assertThat(report.totalAlerts()).isZero();
    }

    @Test
    @DisplayName("Should give the same report when read twice without writes in between")
    void shouldBeIdempotent() {
        // Given
        long product = db.insertProduct("WID-006", "Stable", 10, supplierId);
        long inv = db.insertInventory(product, mainWarehouse, 3);
        db.insertLedgerEntry(inv, "sale", -9, NOW_LOCAL.minusDays(5));

        // When / Then
        assertThat(service.getLowStockAlerts(companyId)).isEqualTo(service.getLowStockAlerts(companyId));
        assertThat(db.countRows("inventory_changes")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should honour a shorter window")
    void shouldApplyCustomWindow() {
        // Given: one sale 10 days ago falls outside a 7-day window
        long product = db.insertProduct("WID-007", "Windowed", 10, supplierId);
        long inv = db.insertInventory(product, mainWarehouse, 3);
        db.insertLedgerEntry(inv, "sale", -7, NOW_LOCAL.minusDays(10));

        // When / Then
        assertThat(service.getLowStockAlerts(companyId, 7).alerts()).isEmpty();
        assertThat(service.getLowStockAlerts(companyId, 30).alerts()).hasSize(1);
    }

    @Test
    @DisplayName("Should alert with the fallback threshold when none is stored")
    void shouldUseFallbackThreshold() {
        // Given
        long product = db.insertProduct("WID-008", "Unconfigured", null, supplierId);
        long inv = db.insertInventory(product, mainWarehouse, 0);
        db.insertLedgerEntry(inv, "sale", -2, NOW_LOCAL.minusDays(1));

        // When
        LowStockAlert alert = service.getLowStockAlerts(companyId).alerts().get(0);

        // Then
        assertThat(alert.threshold()).isEqualTo(1);
        assertThat(alert.thresholdDefaulted()).isTrue();
        assertThat(metrics.getThresholdFallbackCounter().count()).isEqualTo(1.0);
    }
}
