package com.b2b.inventory.model;

/**
 * Understocked inventory row that also has recent sales.
 */
public record AlertRow(
    LowStockCandidate candidate,
    SalesVelocity velocity
) {}
