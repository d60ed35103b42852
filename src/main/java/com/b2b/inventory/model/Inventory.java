package com.b2b.inventory.model;

/**
 * Stock of one product in one warehouse. {@code id} is null until the row is inserted.
 */
public record Inventory(
    Long id,
    long productId,
    long warehouseId,
    int quantity
) {
    public Inventory {
        if (quantity < 0) {
            throw new IllegalArgumentException("Inventory quantity must not be negative: " + quantity);
        }
    }

    public static Inventory newRow(long productId, WarehouseQuantity warehouseQuantity) {
        return new Inventory(null, productId, warehouseQuantity.warehouseId(), warehouseQuantity.quantity());
    }
}
