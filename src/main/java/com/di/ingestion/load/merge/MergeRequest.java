package com.di.ingestion.load.merge;

import com.di.ingestion.catalog.LoadType;
import com.di.ingestion.load.ScdColumns;
import com.di.ingestion.sql.TableRef;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything a {@link MergePolicy} needs to plan the statements of one merge.
 *
 * @param columns all mapped business columns, in mapping order (keys included)
 */
public record MergeRequest(TableRef destination,
                           TableRef source,
                           List<String> keyColumns,
                           List<String> columns,
                           LoadType loadType,
                           ScdColumns scd) {

    public MergeRequest {
        if (keyColumns.isEmpty()) {
            throw new IllegalArgumentException("Merge requires at least one key column");
        }
        keyColumns = List.copyOf(keyColumns);
        columns = List.copyOf(columns);
    }

    /** Business columns compared for changes: everything mapped except the key. */
    public List<String> nonKeyColumns() {
        Set<String> keys = keyColumns.stream()
                .map(k -> k.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        return columns.stream()
                .filter(c -> !keys.contains(c.toUpperCase(Locale.ROOT)))
                .toList();
    }
}
