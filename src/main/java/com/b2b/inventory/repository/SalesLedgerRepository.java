package com.b2b.inventory.repository;

import com.b2b.inventory.model.ChangeType;
import com.b2b.inventory.model.InventoryChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Read-only access to the inventory_changes ledger.
 * Large id lists are chunked to stay under driver parameter limits.
 */
@Repository
@Slf4j
public class SalesLedgerRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;
    private final ReadRetryPolicy retryPolicy;

    public SalesLedgerRepository(NamedParameterJdbcTemplate jdbcTemplate,
                                 SqlTemplateLoader sqlLoader,
                                 ReadRetryPolicy retryPolicy) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Sale entries for the given inventory rows with {@code occurred_at >= since}.
     */
    public List<InventoryChange> findSaleEntriesSince(Collection<Long> inventoryIds, LocalDateTime since) {
        if (inventoryIds.isEmpty()) return List.of();

        List<Long> ids = List.copyOf(inventoryIds);
        if (ids.size() <= retryPolicy.getChunkSize()) {
            return findSaleEntriesInternal(ids, since);
        }

        List<List<Long>> parts = retryPolicy.partition(ids);
        log.info("findSaleEntriesSince: total chunks = {}, chunkSize = {}", parts.size(), retryPolicy.getChunkSize());
        List<InventoryChange> result = new ArrayList<>();
        int chunkNum = 1;
        for (List<Long> chunk : parts) {
            log.debug("findSaleEntriesSince: processing chunk {}/{} ({} ids)", chunkNum, parts.size(), chunk.size());
            result.addAll(findSaleEntriesInternal(chunk, since));
            chunkNum++;
        }
        return result;
    }

    private List<InventoryChange> findSaleEntriesInternal(List<Long> inventoryIds, LocalDateTime since) {
        return retryPolicy.withRetry("findSaleEntriesSince", () -> {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("inventoryIds", inventoryIds)
                    .addValue("changeType", ChangeType.SALE.dbValue())
                    .addValue("since", since);

            return jdbcTemplate.query(sqlLoader.load("findSaleEntriesSince"), params, (rs, rowNum) -> new InventoryChange(
                    rs.getLong("id"),
                    rs.getLong("inventory_id"),
                    ChangeType.fromDbValue(rs.getString("change_type")),
                    rs.getInt("quantity_delta"),
                    rs.getObject("occurred_at", LocalDateTime.class),
                    rs.getString("reference")
            ));
        });
    }
}
