package com.b2b.inventory.model;

import java.util.Arrays;

/**
 * Kind of stock movement recorded in the inventory ledger.
 * Stored in lowercase in the {@code inventory_changes.change_type} column.
 */
public enum ChangeType {
    SALE("sale"),
    RESTOCK("restock"),
    ADJUSTMENT("adjustment");

    private final String dbValue;

    ChangeType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ChangeType fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.dbValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown change type: " + value));
    }
}
