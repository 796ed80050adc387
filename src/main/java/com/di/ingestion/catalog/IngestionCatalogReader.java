package com.di.ingestion.catalog;

import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.schedule.ScheduleDefinition;
import com.di.ingestion.schedule.ScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads header, column mapping and schedule rows for ingestion ids and turns
 * them into validated {@link IngestionDefinition}s.
 *
 * <p>Validation happens here, before any run: an unknown load type, a missing
 * mapping or a unique key that is not covered by the mapping rejects the
 * definition with a logged error and nothing is executed for it. A failed
 * mapping or schedule read rejects only the header it belongs to.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionCatalogReader {

    private final IngestionCatalogRepository catalogRepository;
    private final ScheduleRepository         scheduleRepository;

    /**
     * Loads every active ingestion definition.
     *
     * @return valid definitions in ingestion-id order plus the rejected ones with a reason
     */
    public CatalogLoadResult loadActiveDefinitions(WarehouseContext ctx) {
        List<IngestionHeader> headers = catalogRepository.findActiveHeaders(ctx);
        log.info("[CATALOG] {} active ingestion header(s) found", headers.size());

        List<IngestionDefinition>         valid    = new ArrayList<>(headers.size());
        List<CatalogLoadResult.Rejected>  rejected = new ArrayList<>();

        for (IngestionHeader header : headers) {
            if (LoadType.parse(header.getLoadType()).isEmpty()) {
                String reason = "Unrecognized load type '" + header.getLoadType() + "'";
                log.warn("[CATALOG] ingestionId={} skipped: {}", header.getIngestionId(), reason);
                rejected.add(new CatalogLoadResult.Rejected(header.getIngestionId(), reason));
                continue;
            }
            try {
                valid.add(toDefinition(ctx, header));
            } catch (CatalogValidationException ex) {
                log.error("[CATALOG] ingestionId={} rejected: {}", header.getIngestionId(), ex.getMessage());
                rejected.add(new CatalogLoadResult.Rejected(header.getIngestionId(), ex.getMessage()));
            } catch (RuntimeException ex) {
                String reason = "Catalog read failed: " + ex.getMessage();
                log.error("[CATALOG] ingestionId={} rejected: {}", header.getIngestionId(), reason, ex);
                rejected.add(new CatalogLoadResult.Rejected(header.getIngestionId(), reason));
            }
        }

        log.info("[CATALOG] {} definition(s) ready, {} rejected", valid.size(), rejected.size());
        return new CatalogLoadResult(valid, rejected);
    }

    /**
     * Loads and validates a single active definition.
     *
     * @throws CatalogValidationException when the id is unknown, inactive or misconfigured
     */
    public IngestionDefinition loadDefinition(WarehouseContext ctx, long ingestionId) {
        IngestionHeader header = catalogRepository.findHeader(ctx, ingestionId)
                .orElseThrow(() -> new CatalogValidationException(ingestionId,
                        "Unknown ingestion id " + ingestionId));
        if (!header.isActive()) {
            throw new CatalogValidationException(ingestionId, "Ingestion id " + ingestionId + " is not active");
        }
        return toDefinition(ctx, header);
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    IngestionDefinition toDefinition(WarehouseContext ctx, IngestionHeader header) {
        Long id = header.getIngestionId();
        if (id == null) {
            throw new CatalogValidationException(null, "Ingestion header without ingestion id");
        }

        LoadType loadType = LoadType.parse(header.getLoadType())
                .orElseThrow(() -> new CatalogValidationException(id,
                        "Unrecognized load type '" + header.getLoadType() + "'"));

        requireText(id, header.getSourceStage(), "source stage");
        requireText(id, header.getDestinationTable(), "destination table");
        requireText(id, header.getFileFormat(), "file format");

        List<MappedColumn> mapping = catalogRepository.findColumnMapping(ctx, id);
        if (mapping.isEmpty()) {
            throw new CatalogValidationException(id, "No column mapping rows for ingestion " + id);
        }
        Set<String> mapped = new HashSet<>();
        for (MappedColumn column : mapping) {
            requireText(id, column.getColumnName(), "mapped column name");
            requireText(id, column.getDataType(), "data type of " + column.getColumnName());
            if (column.getSourcePosition() < 1) {
                throw new CatalogValidationException(id, "Column " + column.getColumnName()
                        + " has invalid source position " + column.getSourcePosition());
            }
            if (!mapped.add(column.getColumnName().toUpperCase(Locale.ROOT))) {
                throw new CatalogValidationException(id, "Column " + column.getColumnName() + " is mapped twice");
            }
        }

        List<String> keys = parseKeyColumns(header.getUniqueKey());
        if (keys.isEmpty()) {
            throw new CatalogValidationException(id, "No unique key columns configured for ingestion " + id);
        }
        List<String> unmapped = keys.stream()
                .filter(k -> !mapped.contains(k.toUpperCase(Locale.ROOT)))
                .toList();
        if (!unmapped.isEmpty()) {
            throw new CatalogValidationException(id, "Unique key column(s) " + unmapped + " are not mapped");
        }

        ScheduleDefinition schedule = scheduleRepository.findByIngestionId(ctx, id).orElse(null);

        return IngestionDefinition.builder()
                .ingestionId(id)
                .sourceName(header.getSourceName())
                .sourceStage(header.getSourceStage().trim())
                .fileFormat(header.getFileFormat().trim())
                .destinationTable(header.getDestinationTable().trim())
                .loadType(loadType)
                .keyColumns(keys)
                .columns(List.copyOf(mapping))
                .schedule(schedule)
                .build();
    }

    static List<String> parseKeyColumns(String uniqueKey) {
        if (uniqueKey == null) {
            return List.of();
        }
        return Arrays.stream(uniqueKey.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static void requireText(long id, String value, String what) {
        if (value == null || value.isBlank()) {
            throw new CatalogValidationException(id, "Missing " + what + " for ingestion " + id);
        }
    }
}
