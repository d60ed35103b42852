package com.b2b.inventory.exception;

/**
 * The SKU is already taken, detected either by the pre-check or by the unique constraint.
 */
public class SkuConflictException extends InventoryServiceException {

    private final String sku;

    public SkuConflictException(String sku) {
        super(String.format("SKU must be unique: %s", sku));
        this.sku = sku;
    }

    public SkuConflictException(String sku, Throwable cause) {
        super(String.format("SKU must be unique: %s", sku), cause);
        this.sku = sku;
    }

    public String getSku() {
        return sku;
    }
}
