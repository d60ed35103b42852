package com.b2b.inventory.model;

import java.time.LocalDateTime;

/**
 * Immutable ledger entry. Negative deltas are stock leaving the warehouse.
 */
public record InventoryChange(
    long id,
    long inventoryId,
    ChangeType changeType,
    int quantityDelta,
    LocalDateTime occurredAt,
    String reference
) {
    /**
     * Units that left stock with this entry, zero for inbound movements.
     */
    public int unitsOut() {
        return quantityDelta < 0 ? -quantityDelta : 0;
    }
}
