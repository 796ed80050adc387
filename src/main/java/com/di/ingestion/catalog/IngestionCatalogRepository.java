package com.di.ingestion.catalog;

import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.sql.SqlDialect;
import com.di.ingestion.sql.TableRef;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for the ingestion header and column-mapping catalog tables.
 */
@Repository
@RequiredArgsConstructor
public class IngestionCatalogRepository {

    private final JdbcTemplate        jdbc;
    private final SqlDialect          dialect;
    private final IngestionProperties properties;

    // ------------------------------------------------------------------
    // RowMappers
    // ------------------------------------------------------------------

    static final RowMapper<IngestionHeader> HEADER_MAPPER = (rs, n) -> {
        IngestionHeader h = new IngestionHeader();
        long id = rs.getLong("ingestion_id");
        h.setIngestionId(rs.wasNull() ? null : id);
        h.setSourceName(rs.getString("source_name"));
        h.setSourceStage(rs.getString("source_stage"));
        h.setFileFormat(rs.getString("file_format"));
        h.setDestinationTable(rs.getString("destination_table"));
        h.setLoadType(rs.getString("load_type"));
        h.setUniqueKey(rs.getString("unique_key"));
        h.setActive(rs.getBoolean("is_active"));
        return h;
    };

    static final RowMapper<MappedColumn> MAPPING_MAPPER = (rs, n) -> MappedColumn.builder()
            .columnName(rs.getString("column_name"))
            .dataType(rs.getString("data_type"))
            .sourcePosition(rs.getInt("source_position"))
            .build();

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public List<IngestionHeader> findActiveHeaders(WarehouseContext ctx) {
        return jdbc.query("""
            SELECT ingestion_id, source_name, source_stage, file_format,
                   destination_table, load_type, unique_key, is_active
              FROM %s
             WHERE is_active = TRUE
             ORDER BY ingestion_id
            """.formatted(headerTable(ctx)), HEADER_MAPPER);
    }

    public Optional<IngestionHeader> findHeader(WarehouseContext ctx, long ingestionId) {
        List<IngestionHeader> rows = jdbc.query("""
            SELECT ingestion_id, source_name, source_stage, file_format,
                   destination_table, load_type, unique_key, is_active
              FROM %s
             WHERE ingestion_id = ?
            """.formatted(headerTable(ctx)), HEADER_MAPPER, ingestionId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Column mapping ordered by source position, which is also the staging column order. */
    public List<MappedColumn> findColumnMapping(WarehouseContext ctx, long ingestionId) {
        return jdbc.query("""
            SELECT column_name, data_type, source_position
              FROM %s
             WHERE ingestion_id = ?
             ORDER BY source_position
            """.formatted(mappingTable(ctx)), MAPPING_MAPPER, ingestionId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String headerTable(WarehouseContext ctx) {
        return catalogTable(ctx, properties.getCatalog().getHeaderTable());
    }

    private String mappingTable(WarehouseContext ctx) {
        return catalogTable(ctx, properties.getCatalog().getMappingTable());
    }

    private String catalogTable(WarehouseContext ctx, String name) {
        return dialect.renderTable(TableRef.of(ctx.database(), ctx.catalogSchema(), name));
    }
}
