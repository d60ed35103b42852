package com.b2b.inventory.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Alert for one product in one warehouse.
 * {@code thresholdDefaulted} is only serialized when the stored threshold was missing.
 */
public record LowStockAlert(
    long productId,
    String productName,
    String sku,
    long warehouseId,
    String warehouseName,
    int currentStock,
    int threshold,
    Long daysUntilStockout,
    Supplier supplier,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean thresholdDefaulted
) {}
