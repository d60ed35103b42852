package com.b2b.inventory.service.alert;

import com.b2b.inventory.config.AppMetrics;
import com.b2b.inventory.model.AlertRow;
import com.b2b.inventory.model.LowStockAlert;
import com.b2b.inventory.model.LowStockCandidate;
import com.b2b.inventory.model.SalesVelocity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Shapes alert rows into client-facing alerts.
 */
@Component
@Slf4j
public class AlertAssembler {

    private final int thresholdFallback;
    private final AppMetrics metrics;

    public AlertAssembler(@Value("${app.alerts.threshold-fallback:1}") int thresholdFallback, AppMetrics metrics) {
        this.thresholdFallback = thresholdFallback;
        this.metrics = metrics;
    }

    public LowStockAlert assemble(AlertRow row) {
        LowStockCandidate candidate = row.candidate();
        SalesVelocity velocity = row.velocity();

        boolean thresholdDefaulted = candidate.threshold() == null;
        int threshold = thresholdDefaulted ? thresholdFallback : candidate.threshold();
        if (thresholdDefaulted) {
            // Missing thresholds usually mean incomplete product data
            metrics.incrementThresholdFallbacks();
            log.warn("Product {} (sku={}) has no low-stock threshold, alerting with fallback {} in warehouse {}",
                    candidate.productId(), candidate.sku(), thresholdFallback, candidate.warehouseId());
        }

        Long daysUntilStockout = velocity != null ? velocity.daysUntilStockout(candidate.currentStock()) : null;

        return new LowStockAlert(
                candidate.productId(),
                candidate.productName(),
                candidate.sku(),
                candidate.warehouseId(),
                candidate.warehouseName(),
                candidate.currentStock(),
                threshold,
                daysUntilStockout,
                candidate.supplier(),
                thresholdDefaulted
        );
    }
}
