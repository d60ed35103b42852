package com.b2b.inventory.service.validation;

import com.b2b.inventory.exception.ProductValidationException;
import com.b2b.inventory.model.ValidatedProductRequest;
import com.b2b.inventory.model.WarehouseQuantity;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural validation of product creation requests.
 *
 * Pure: no store access and no side effects. The first problem found fails the
 * whole request; there is no partial acceptance of warehouse entries.
 *
 * SKU RULES:
 * - Stored exactly as sent: surrounding whitespace is rejected, not trimmed
 *
 * PRICE RULES:
 * - JSON string or JSON number, parsed as BigDecimal (the ObjectMapper reads floats as BigDecimal)
 * - Not negative, at most 2 fractional digits and 10 integer digits (DECIMAL(12,2))
 */
@Component
public class ProductRequestValidator {

    static final List<String> REQUIRED_FIELDS = List.of("name", "sku", "price", "warehouse_quantities");

    static final int MAX_SKU_LENGTH = 64;
    static final int MAX_NAME_LENGTH = 255;
    static final int PRICE_SCALE = 2;
    static final int PRICE_INTEGER_DIGITS = 10;

    public ValidatedProductRequest validate(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new ProductValidationException("body", "Request body must be a JSON object.");
        }

        for (String field : REQUIRED_FIELDS) {
            if (!raw.hasNonNull(field)) {
                throw new ProductValidationException(field, "Missing required field: " + field);
            }
        }

        String name = requireText(raw.get("name"), "name", MAX_NAME_LENGTH);
        String sku = requireText(raw.get("sku"), "sku", MAX_SKU_LENGTH);
        if (!sku.equals(raw.get("sku").asText())) {
            throw new ProductValidationException("sku", "sku must not have leading or trailing whitespace.");
        }
        BigDecimal price = parsePrice(raw.get("price"));
        List<WarehouseQuantity> warehouseQuantities = parseWarehouseQuantities(raw.get("warehouse_quantities"));

        Integer threshold = null;
        if (raw.hasNonNull("low_stock_threshold")) {
            int value = requireInt(raw.get("low_stock_threshold"), "low_stock_threshold");
            if (value < 0) {
                throw new ProductValidationException("low_stock_threshold", "low_stock_threshold must not be negative.");
            }
            threshold = value;
        }

        Long supplierId = null;
        if (raw.hasNonNull("supplier_id")) {
            supplierId = requireLong(raw.get("supplier_id"), "supplier_id");
        }

        boolean bundle = false;
        if (raw.hasNonNull("is_bundle")) {
            JsonNode node = raw.get("is_bundle");
            if (!node.isBoolean()) {
                throw new ProductValidationException("is_bundle", "is_bundle must be true or false.");
            }
            bundle = node.booleanValue();
        }

        return new ValidatedProductRequest(name, sku, price, warehouseQuantities, threshold, supplierId, bundle);
    }

    private String requireText(JsonNode node, String field, int maxLength) {
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new ProductValidationException(field, field + " must be a non-empty string.");
        }
        String value = node.asText().trim();
        if (value.length() > maxLength) {
            throw new ProductValidationException(field, field + " must be at most " + maxLength + " characters.");
        }
        return value;
    }

    private BigDecimal parsePrice(JsonNode node) {
        BigDecimal price;
        if (node.isNumber()) {
            price = node.decimalValue();
        } else if (node.isTextual()) {
            try {
                price = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ProductValidationException("price", "Invalid price format.");
            }
        } else {
            throw new ProductValidationException("price", "Invalid price format.");
        }

        if (price.signum() < 0) {
            throw new ProductValidationException("price", "Price must not be negative.");
        }
        BigDecimal normalized = price.stripTrailingZeros();
        if (normalized.scale() > PRICE_SCALE) {
            throw new ProductValidationException("price", "Price must have at most " + PRICE_SCALE + " decimal places.");
        }
        if (normalized.precision() - normalized.scale() > PRICE_INTEGER_DIGITS) {
            throw new ProductValidationException("price", "Price is too large.");
        }
        return price.setScale(PRICE_SCALE);
    }

    private List<WarehouseQuantity> parseWarehouseQuantities(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new ProductValidationException("warehouse_quantities", "warehouse_quantities must be a non-empty list.");
        }

        List<WarehouseQuantity> result = new ArrayList<>(node.size());
        Set<Long> seenWarehouses = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            String prefix = "warehouse_quantities[" + i + "]";
            JsonNode entry = node.get(i);
            if (!entry.isObject() || !entry.hasNonNull("warehouse_id") || !entry.hasNonNull("quantity")) {
                throw new ProductValidationException(prefix,
                        "Each warehouse entry must have warehouse_id and non-negative integer quantity.");
            }

            long warehouseId = requireLong(entry.get("warehouse_id"), prefix + ".warehouse_id");
            int quantity = requireInt(entry.get("quantity"), prefix + ".quantity");
            if (quantity < 0) {
                throw new ProductValidationException(prefix + ".quantity", "Quantity must not be negative.");
            }
            if (!seenWarehouses.add(warehouseId)) {
                throw new ProductValidationException(prefix + ".warehouse_id",
                        "Warehouse " + warehouseId + " is listed more than once.");
            }
            result.add(new WarehouseQuantity(warehouseId, quantity));
        }
        return result;
    }

    private int requireInt(JsonNode node, String field) {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ProductValidationException(field, field + " must be an integer.");
        }
        return node.intValue();
    }

    private long requireLong(JsonNode node, String field) {
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new ProductValidationException(field, field + " must be an integer.");
        }
        return node.longValue();
    }
}
