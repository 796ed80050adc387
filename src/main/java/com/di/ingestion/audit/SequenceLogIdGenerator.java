package com.di.ingestion.audit;

import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.sql.SqlDialect;
import com.di.ingestion.sql.TableRef;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Draws log ids from the catalog sequence ({@code SELECT <seq>.NEXTVAL}).
 */
@Component
@RequiredArgsConstructor
public class SequenceLogIdGenerator implements LogIdGenerator {

    private final JdbcTemplate        jdbc;
    private final SqlDialect          dialect;
    private final IngestionProperties properties;

    @Override
    public long nextId(WarehouseContext ctx) {
        String sequence = dialect.renderTable(
                TableRef.of(ctx.database(), ctx.catalogSchema(), properties.getCatalog().getLogSequence()));
        Long id = jdbc.queryForObject("SELECT %s.NEXTVAL".formatted(sequence), Long.class);
        if (id == null) {
            throw new EmptyResultDataAccessException("Sequence " + sequence + " returned no value", 1);
        }
        return id;
    }
}
