package com.b2b.inventory.service;

import com.b2b.inventory.config.AppMetrics;
import com.b2b.inventory.exception.ProductValidationException;
import com.b2b.inventory.model.ValidatedProductRequest;
import com.b2b.inventory.service.validation.ProductRequestValidator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Write path entry point: validation gate, then the transactional writer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProductService {

    private final ProductRequestValidator validator;
    private final ProductInventoryWriter writer;
    private final AppMetrics metrics;

    public long createProduct(JsonNode rawRequest) {
        ValidatedProductRequest request;
        try {
            request = validator.validate(rawRequest);
        } catch (ProductValidationException e) {
            metrics.incrementProductRejections();
            log.info("Rejected product request: field={} reason={}", e.getField(), e.getMessage());
            throw e;
        }
        return writer.createProductWithInventory(request);
    }
}
