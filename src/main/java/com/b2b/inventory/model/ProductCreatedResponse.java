package com.b2b.inventory.model;

public record ProductCreatedResponse(
    String message,
    long productId
) {
    public static ProductCreatedResponse of(long productId) {
        return new ProductCreatedResponse("Product created", productId);
    }
}
