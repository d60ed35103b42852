package com.b2b.inventory.exception;

/**
 * Any other failure. The message is safe to log but is never sent to clients.
 */
public class UnexpectedInventoryException extends InventoryServiceException {

    public UnexpectedInventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
