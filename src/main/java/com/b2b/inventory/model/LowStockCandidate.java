package com.b2b.inventory.model;

/**
 * Inventory row below its product threshold, joined with product, warehouse and supplier.
 * {@code threshold} is the stored value and may be null.
 */
public record LowStockCandidate(
    long inventoryId,
    long productId,
    String productName,
    String sku,
    long warehouseId,
    String warehouseName,
    int currentStock,
    Integer threshold,
    Supplier supplier
) {}
