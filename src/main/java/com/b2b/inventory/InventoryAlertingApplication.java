package com.b2b.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Inventory service: atomic product creation across warehouses and low-stock alerting.
 */
@SpringBootApplication
public class InventoryAlertingApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryAlertingApplication.class, args);
    }
}
