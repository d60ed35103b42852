package com.b2b.inventory.controller;

import com.b2b.inventory.model.ProductCreatedResponse;
import com.b2b.inventory.service.ProductService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/products
 *
 * The body is taken as a raw JSON tree so the validation gate sees the client's
 * actual types (string vs number price, integral quantities).
 */
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @PostMapping
    public ResponseEntity<ProductCreatedResponse> createProduct(@RequestBody(required = false) JsonNode body) {
        long productId = productService.createProduct(body);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductCreatedResponse.of(productId));
    }
}
