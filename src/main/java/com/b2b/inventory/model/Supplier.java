package com.b2b.inventory.model;

/**
 * Supplier of a product. One supplier per product.
 */
public record Supplier(
    long id,
    String name,
    String contactEmail
) {}
