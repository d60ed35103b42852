package com.b2b.inventory.exception;

/**
 * A creation request is structurally invalid.
 */
public class ProductValidationException extends InventoryServiceException {

    private final String field;

    public ProductValidationException(String field, String reason) {
        super(reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
