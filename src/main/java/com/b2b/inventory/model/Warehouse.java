package com.b2b.inventory.model;

/**
 * Warehouse owned by exactly one company.
 */
public record Warehouse(
    long id,
    long companyId,
    String name,
    String location
) {}
