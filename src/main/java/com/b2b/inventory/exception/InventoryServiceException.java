package com.b2b.inventory.exception;

/**
 * Base class for failures the inventory core reports to its callers.
 * Unchecked: callers translate them at the transport edge.
 */
public abstract class InventoryServiceException extends RuntimeException {

    protected InventoryServiceException(String message) {
        super(message);
    }

    protected InventoryServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
