package com.b2b.inventory.repository;

import com.b2b.inventory.model.Warehouse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@Slf4j
public class WarehouseRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;
    private final ReadRetryPolicy retryPolicy;

    public WarehouseRepository(NamedParameterJdbcTemplate jdbcTemplate,
                               SqlTemplateLoader sqlLoader,
                               ReadRetryPolicy retryPolicy) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
        this.retryPolicy = retryPolicy;
    }

    public List<Warehouse> findByCompanyId(long companyId) {
        log.debug("Looking up warehouses for company {}", companyId);
        return retryPolicy.withRetry("findWarehousesByCompanyId", () -> jdbcTemplate.query(
                sqlLoader.load("findWarehousesByCompanyId"),
                new MapSqlParameterSource("companyId", companyId),
                (rs, rowNum) -> new Warehouse(
                        rs.getLong("id"),
                        rs.getLong("company_id"),
                        rs.getString("name"),
                        rs.getString("location")
                )));
    }
}
