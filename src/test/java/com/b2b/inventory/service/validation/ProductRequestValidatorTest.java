package com.b2b.inventory.service.validation;

import com.b2b.inventory.config.JacksonConfig;
import com.b2b.inventory.exception.ProductValidationException;
import com.b2b.inventory.model.ValidatedProductRequest;
import com.b2b.inventory.model.WarehouseQuantity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ProductRequestValidator.
 *
 * Requests are parsed with the application ObjectMapper so number handling matches the HTTP layer.
 */
class ProductRequestValidatorTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private ProductRequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ProductRequestValidator();
    }

    @Test
    @DisplayName("Should accept a complete request and keep entry order")
    void shouldAcceptValidRequest() throws Exception {
        ValidatedProductRequest request = validator.validate(json("""
                {"name": "Widget", "sku": "WID-001", "price": "12.50",
                 "warehouse_quantities": [{"warehouse_id": 2, "quantity": 10},
                                          {"warehouse_id": 1, "quantity": 0}]}
                """));

        assertThat(request.name()).isEqualTo("Widget");
        assertThat(request.sku()).isEqualTo("WID-001");
        assertThat(request.price()).isEqualByComparingTo("12.50");
        assertThat(request.warehouseQuantities())
                .containsExactly(new WarehouseQuantity(2, 10), new WarehouseQuantity(1, 0));
        assertThat(request.lowStockThreshold()).isNull();
        assertThat(request.supplierId()).isNull();
    }

    @Test
    @DisplayName("Should keep a JSON number price exact")
    void shouldKeepNumericPriceExact() throws Exception {
        ValidatedProductRequest request = validator.validate(json("""
                {"name": "Widget", "sku": "WID-001", "price": 19.99,
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """));

        assertThat(request.price()).isEqualTo(new BigDecimal("19.99"));
    }

    @Test
    @DisplayName("Should read optional threshold and supplier")
    void shouldReadOptionalFields() throws Exception {
        ValidatedProductRequest request = validator.validate(json("""
                {"name": "Widget", "sku": "WID-001", "price": 5,
                 "low_stock_threshold": 20, "supplier_id": 7,
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """));

        assertThat(request.lowStockThreshold()).isEqualTo(20);
        assertThat(request.supplierId()).isEqualTo(7L);
        assertThat(request.bundle()).isFalse();
        assertThat(request.price()).isEqualByComparingTo("5.00");
    }

    @Test
    @DisplayName("Should read the bundle flag")
    void shouldReadBundleFlag() throws Exception {
        ValidatedProductRequest request = validator.validate(json("""
                {"name": "Starter Kit", "sku": "KIT-001", "price": "49.00", "is_bundle": true,
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """));

        assertThat(request.bundle()).isTrue();
    }

    @Test
    @DisplayName("Should reject a bundle flag that is not a boolean")
    void shouldRejectNonBooleanBundleFlag() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.00", "is_bundle": "yes",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "is_bundle");
    }

    @Test
    @DisplayName("Should reject a SKU padded with whitespace instead of trimming it")
    void shouldRejectPaddedSku() {
        assertFieldError("""
                {"name": "W", "sku": " ABC ", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "sku");
        assertFieldError("""
                {"name": "W", "sku": "ABC\\t", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "sku");
    }

    @Test
    @DisplayName("Should name the first missing required field")
    void shouldRejectMissingField() {
        assertThatThrownBy(() -> validator.validate(json("""
                {"name": "Widget", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """)))
                .isInstanceOf(ProductValidationException.class)
                .hasMessage("Missing required field: sku")
                .extracting("field").isEqualTo("sku");
    }

    @Test
    @DisplayName("Should reject non-numeric and malformed prices")
    void shouldRejectMalformedPrice() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "twelve",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "price");
        assertFieldError("""
                {"name": "W", "sku": "S", "price": true,
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "price");
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.2.3",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "price");
    }

    @Test
    @DisplayName("Should reject prices the store cannot hold exactly")
    void shouldRejectOutOfRangePrice() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "-1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "price");
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.999",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "price");
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "12345678901.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "price");
    }

    @Test
    @DisplayName("Should reject an empty warehouse list")
    void shouldRejectEmptyWarehouseList() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.00", "warehouse_quantities": []}
                """, "warehouse_quantities");
    }

    @Test
    @DisplayName("Should reject the whole request when one entry is bad")
    void shouldRejectWholeRequestOnOneBadEntry() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5},
                                          {"warehouse_id": 2, "quantity": -1}]}
                """, "warehouse_quantities[1].quantity");
    }

    @Test
    @DisplayName("Should require integral quantities, not strings or fractions")
    void shouldRejectNonIntegerQuantity() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": "5"}]}
                """, "warehouse_quantities[0].quantity");
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 2.5}]}
                """, "warehouse_quantities[0].quantity");
    }

    @Test
    @DisplayName("Should reject entries without warehouse_id")
    void shouldRejectEntryWithoutWarehouse() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.00",
                 "warehouse_quantities": [{"quantity": 5}]}
                """, "warehouse_quantities[0]");
    }

    @Test
    @DisplayName("Should reject the same warehouse listed twice")
    void shouldRejectDuplicateWarehouse() {
        assertFieldError("""
                {"name": "W", "sku": "S", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 3, "quantity": 5},
                                          {"warehouse_id": 3, "quantity": 1}]}
                """, "warehouse_quantities[1].warehouse_id");
    }

    @Test
    @DisplayName("Should reject blank names and over-long SKUs")
    void shouldRejectBadText() {
        assertFieldError("""
                {"name": "  ", "sku": "S", "price": "1.00",
                 "warehouse_quantities": [{"warehouse_id": 1, "quantity": 5}]}
                """, "name");
        assertFieldError("{\"name\": \"W\", \"sku\": \"" + "X".repeat(65) + "\", \"price\": \"1.00\","
                + " \"warehouse_quantities\": [{\"warehouse_id\": 1, \"quantity\": 5}]}", "sku");
    }

    @Test
    @DisplayName("Should reject a missing or non-object body")
    void shouldRejectNonObjectBody() throws Exception {
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(ProductValidationException.class)
                .extracting("field").isEqualTo("body");
        assertThatThrownBy(() -> validator.validate(json("[1, 2]")))
                .isInstanceOf(ProductValidationException.class)
                .extracting("field").isEqualTo("body");
    }

    // ═══════════════════════════════════════════════════════════════
    // Helper Methods
    // ═══════════════════════════════════════════════════════════════

    private JsonNode json(String body) throws Exception {
        return objectMapper.readTree(body);
    }

    private void assertFieldError(String body, String expectedField) {
        assertThatThrownBy(() -> validator.validate(json(body)))
                .isInstanceOf(ProductValidationException.class)
                .extracting("field").isEqualTo(expectedField);
    }
}
