package com.b2b.inventory.model;

import java.math.BigDecimal;

/**
 * Product row. {@code lowStockThreshold} and {@code supplierId} are nullable in the store.
 * Bundle contents live in {@code product_bundles}.
 */
public record Product(
    long id,
    String sku,
    String name,
    BigDecimal price,
    Integer lowStockThreshold,
    Long supplierId,
    boolean bundle
) {}
