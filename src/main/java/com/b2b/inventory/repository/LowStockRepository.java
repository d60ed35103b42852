package com.b2b.inventory.repository;

import com.b2b.inventory.model.LowStockCandidate;
import com.b2b.inventory.model.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Joins inventory, product, warehouse and supplier for rows under their threshold.
 */
@Repository
@Slf4j
public class LowStockRepository {

    private static final Comparator<LowStockCandidate> PRODUCT_THEN_WAREHOUSE =
            Comparator.comparingLong(LowStockCandidate::productId)
                    .thenComparingLong(LowStockCandidate::warehouseId);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;
    private final ReadRetryPolicy retryPolicy;

    public LowStockRepository(NamedParameterJdbcTemplate jdbcTemplate,
                              SqlTemplateLoader sqlLoader,
                              ReadRetryPolicy retryPolicy) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Inventory rows in the given warehouses with {@code quantity < threshold}; a null
     * threshold compares against {@code thresholdFallback}. Ordered by product id, then warehouse id.
     */
    public List<LowStockCandidate> findLowStockCandidates(Collection<Long> warehouseIds, int thresholdFallback) {
        if (warehouseIds.isEmpty()) return List.of();

        List<Long> ids = List.copyOf(warehouseIds);
        if (ids.size() <= retryPolicy.getChunkSize()) {
            return findCandidatesInternal(ids, thresholdFallback);
        }

        List<List<Long>> parts = retryPolicy.partition(ids);
        log.info("findLowStockCandidates: total chunks = {}, chunkSize = {}", parts.size(), retryPolicy.getChunkSize());
        List<LowStockCandidate> result = new ArrayList<>();
        for (List<Long> chunk : parts) {
            result.addAll(findCandidatesInternal(chunk, thresholdFallback));
        }
        result.sort(PRODUCT_THEN_WAREHOUSE);
        return result;
    }

    private List<LowStockCandidate> findCandidatesInternal(List<Long> warehouseIds, int thresholdFallback) {
        return retryPolicy.withRetry("findLowStockCandidates", () -> {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("warehouseIds", warehouseIds)
                    .addValue("thresholdFallback", thresholdFallback);

            return jdbcTemplate.query(sqlLoader.load("findLowStockCandidates"), params, (rs, rowNum) -> new LowStockCandidate(
                    rs.getLong("inventory_id"),
                    rs.getLong("product_id"),
                    rs.getString("product_name"),
                    rs.getString("sku"),
                    rs.getLong("warehouse_id"),
                    rs.getString("warehouse_name"),
                    rs.getInt("current_stock"),
                    rs.getObject("threshold", Integer.class),
                    new Supplier(
                            rs.getLong("supplier_id"),
                            rs.getString("supplier_name"),
                            rs.getString("supplier_contact_email")
                    )
            ));
        });
    }
}
