package com.b2b.inventory.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Product creation request that passed structural validation.
 * Optional fields are null when absent.
 */
public record ValidatedProductRequest(
    String name,
    String sku,
    BigDecimal price,
    List<WarehouseQuantity> warehouseQuantities,
    Integer lowStockThreshold,
    Long supplierId,
    boolean bundle
) {
    public ValidatedProductRequest {
        warehouseQuantities = List.copyOf(warehouseQuantities);
    }

    public ValidatedProductRequest(String name, String sku, BigDecimal price,
                                   List<WarehouseQuantity> warehouseQuantities,
                                   Integer lowStockThreshold, Long supplierId) {
        this(name, sku, price, warehouseQuantities, lowStockThreshold, supplierId, false);
    }
}
