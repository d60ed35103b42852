package com.b2b.inventory.service;

import com.b2b.inventory.config.AppMetrics;
import com.b2b.inventory.exception.InventoryConstraintException;
import com.b2b.inventory.exception.SkuConflictException;
import com.b2b.inventory.exception.UnexpectedInventoryException;
import com.b2b.inventory.model.Inventory;
import com.b2b.inventory.model.ValidatedProductRequest;
import com.b2b.inventory.repository.ProductRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Creates a product together with its inventory rows as one all-or-nothing unit.
 *
 * TRANSACTION:
 * - One TransactionTemplate scope, one commit at the end of the callback
 * - Any exception inside the callback rolls back product and inventory rows together
 * - Exceptions are translated only after the rollback has happened
 *
 * UNIQUENESS:
 * - existsBySku is an early, friendlier rejection only
 * - Two concurrent creations can both pass it; the unique constraint on products.sku
 *   decides, and its violation is reported as SkuConflictException
 */
@Service
@Slf4j
public class ProductInventoryWriter {

    private final ProductRepository productRepository;
    private final TransactionTemplate transactionTemplate;
    private final AppMetrics metrics;

    public ProductInventoryWriter(ProductRepository productRepository,
                                  PlatformTransactionManager transactionManager,
                                  AppMetrics metrics) {
        this.productRepository = productRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metrics = metrics;
    }

    /**
     * @return id of the new product
     * @throws SkuConflictException          the SKU already exists
     * @throws InventoryConstraintException  the store rejected a reference or another constraint
     * @throws UnexpectedInventoryException  anything else; nothing was written
     */
    public long createProductWithInventory(ValidatedProductRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            long productId = createInternal(request);
            metrics.incrementProductsCreated();
            log.info("Created product {} (sku={}) with {} inventory rows in {}ms",
                    productId, request.sku(), request.warehouseQuantities().size(),
                    System.currentTimeMillis() - startTime);
            return productId;
        } finally {
            metrics.recordProductCreateTime(System.currentTimeMillis() - startTime);
        }
    }

    private long createInternal(ValidatedProductRequest request) {
        if (productRepository.existsBySku(request.sku())) {
            metrics.incrementProductConflicts();
            log.warn("Rejected product creation: sku {} already exists", request.sku());
            throw new SkuConflictException(request.sku());
        }

        try {
            Long productId = transactionTemplate.execute(status -> {
                long id = productRepository.insertProduct(request);

                List<Inventory> rows = request.warehouseQuantities().stream()
                        .map(wq -> Inventory.newRow(id, wq))
                        .toList();
                productRepository.insertInventory(rows);
                return id;
            });
            if (productId == null) {
                throw new IllegalStateException("Transaction completed without a product id");
            }
            return productId;
        } catch (DuplicateKeyException e) {
            metrics.incrementProductConflicts();
            log.warn("Unique constraint rejected sku {} at insert time, transaction rolled back", request.sku());
            throw new SkuConflictException(request.sku(), e);
        } catch (DataIntegrityViolationException e) {
            metrics.incrementProductRejections();
            log.warn("Integrity constraint rejected product sku {}, transaction rolled back: {}",
                    request.sku(), e.getMostSpecificCause().getMessage());
            throw new InventoryConstraintException(
                    "Database constraint violated, possibly an invalid warehouse_id or supplier_id.", e);
        } catch (RuntimeException e) {
            metrics.incrementProductFailures();
            log.error("Unexpected failure creating product sku {}, transaction rolled back", request.sku(), e);
            throw new UnexpectedInventoryException("Failed to create product " + request.sku(), e);
        }
    }
}
