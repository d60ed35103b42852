package com.b2b.inventory.exception;

/**
 * The store rejected the write on an integrity constraint other than SKU uniqueness,
 * typically a warehouse or supplier id that does not exist.
 */
public class InventoryConstraintException extends InventoryServiceException {

    public InventoryConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}
