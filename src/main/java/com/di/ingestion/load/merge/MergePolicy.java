package com.di.ingestion.load.merge;

import com.di.ingestion.sql.SqlStatement;

import java.util.List;

/**
 * Plans the statements that merge a deduplicated batch into an SCD destination.
 *
 * <p>Implementations are selected by {@code ingestion.merge.versioning}:
 * {@link InPlaceMergePolicy} ({@code IN_PLACE}, default) and
 * {@link CloseAndInsertMergePolicy} ({@code CLOSE_AND_INSERT}).
 */
public interface MergePolicy {

    /** Configuration name of the policy. */
    String name();

    /** Statements to execute in order; counts are summed over their results. */
    List<SqlStatement> plan(MergeRequest request);
}
