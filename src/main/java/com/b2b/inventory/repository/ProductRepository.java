package com.b2b.inventory.repository;

import com.b2b.inventory.model.Inventory;
import com.b2b.inventory.model.Product;
import com.b2b.inventory.model.ValidatedProductRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.List;
import java.util.Optional;

/**
 * Product and inventory writes. Callers own the transaction; nothing here commits.
 */
@Repository
@Slf4j
public class ProductRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public ProductRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    public boolean existsBySku(String sku) {
        return countBySku(sku) > 0;
    }

    public int countBySku(String sku) {
        Integer count = jdbcTemplate.queryForObject(
                sqlLoader.load("countBySku"),
                new MapSqlParameterSource("sku", sku),
                Integer.class);
        return count != null ? count : 0;
    }

    /**
     * Inserts the product row and returns its generated id.
     */
    public long insertProduct(ValidatedProductRequest request) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("sku", request.sku())
                .addValue("name", request.name())
                .addValue("price", request.price(), Types.DECIMAL)
                .addValue("lowStockThreshold", request.lowStockThreshold(), Types.INTEGER)
                .addValue("supplierId", request.supplierId(), Types.BIGINT)
                .addValue("bundle", request.bundle());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sqlLoader.load("insertProduct"), params, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DataRetrievalFailureException("No generated key returned for product sku " + request.sku());
        }
        log.debug("Inserted product sku={} id={}", request.sku(), key);
        return key.longValue();
    }

    /**
     * Inserts all inventory rows as one JDBC batch.
     */
    public int[] insertInventory(List<Inventory> rows) {
        if (rows.isEmpty()) return new int[0];

        SqlParameterSource[] batch = rows.stream()
                .map(row -> new MapSqlParameterSource()
                        .addValue("productId", row.productId())
                        .addValue("warehouseId", row.warehouseId())
                        .addValue("quantity", row.quantity()))
                .toArray(SqlParameterSource[]::new);

        int[] counts = jdbcTemplate.batchUpdate(sqlLoader.load("insertInventory"), batch);
        log.debug("Inserted {} inventory rows for product {}", rows.size(), rows.get(0).productId());
        return counts;
    }

    public Optional<Product> findById(long productId) {
        List<Product> rows = jdbcTemplate.query(
                sqlLoader.load("findProductById"),
                new MapSqlParameterSource("productId", productId),
                (rs, rowNum) -> new Product(
                        rs.getLong("id"),
                        rs.getString("sku"),
                        rs.getString("name"),
                        rs.getBigDecimal("price"),
                        rs.getObject("low_stock_threshold", Integer.class),
                        rs.getObject("supplier_id", Long.class),
                        rs.getBoolean("is_bundle")
                ));
        return rows.stream().findFirst();
    }

    public List<Inventory> findInventoryByProductId(long productId) {
        return jdbcTemplate.query(
                sqlLoader.load("findInventoryByProductId"),
                new MapSqlParameterSource("productId", productId),
                (rs, rowNum) -> new Inventory(
                        rs.getLong("id"),
                        rs.getLong("product_id"),
                        rs.getLong("warehouse_id"),
                        rs.getInt("quantity")
                ));
    }
}
