package com.b2b.inventory.model;

import java.util.List;

public record LowStockAlertReport(
    List<LowStockAlert> alerts,
    int totalAlerts
) {
    public static LowStockAlertReport of(List<LowStockAlert> alerts) {
        return new LowStockAlertReport(List.copyOf(alerts), alerts.size());
    }
}
