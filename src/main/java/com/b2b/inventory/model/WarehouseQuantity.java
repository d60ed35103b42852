package com.b2b.inventory.model;

/**
 * Initial stock requested for one warehouse.
 */
public record WarehouseQuantity(
    long warehouseId,
    int quantity
) {}
