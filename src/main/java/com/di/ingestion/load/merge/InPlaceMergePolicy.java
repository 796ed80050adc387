package com.di.ingestion.load.merge;

import com.di.ingestion.load.ScdColumns;
import com.di.ingestion.sql.SqlExpr;
import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.SqlStatement.WhenMatchedUpdate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.di.ingestion.load.merge.MergeStatements.*;

/**
 * Single-statement merge that closes a changed row in place.
 *
 * <p>A changed current row gets the new business values together with
 * flag FALSE and an end-date, and no new current version is inserted for
 * that key. Keys not present in the destination are inserted as current.
 * This keeps the historical behaviour of the pipeline; set
 * {@code ingestion.merge.versioning=CLOSE_AND_INSERT} for full version history.
 *
 * <ul>
 *   <li><b>FULL</b>: matched rows with any differing non-key column are closed.</li>
 *   <li><b>INCREMENTAL</b>: as FULL, restricted to current target rows.</li>
 *   <li><b>BULK</b>: every matched current row is closed, no comparison.</li>
 *   <li><b>APPEND</b>: every source row inserted as current.</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "ingestion.merge.versioning", havingValue = "IN_PLACE", matchIfMissing = true)
public class InPlaceMergePolicy implements MergePolicy {

    public static final String NAME = "IN_PLACE";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SqlStatement> plan(MergeRequest request) {
        ScdColumns scd = request.scd();
        SqlExpr on = keyMatch(request.keyColumns());
        SqlExpr differs = anyColumnDiffers(request.nonKeyColumns());

        return switch (request.loadType()) {
            case FULL -> List.of(merge(request, on,
                    List.of(new WhenMatchedUpdate(differs,
                            concat(copyFromSource(request.nonKeyColumns()), close(scd)))),
                    insertCurrentVersion(request)));
            case INCREMENTAL -> List.of(merge(request, on,
                    List.of(new WhenMatchedUpdate(SqlExpr.and(targetIsCurrent(scd), differs),
                            concat(copyFromSource(request.nonKeyColumns()), close(scd)))),
                    insertCurrentVersion(request)));
            case BULK -> List.of(merge(request, on,
                    List.of(new WhenMatchedUpdate(targetIsCurrent(scd), close(scd))),
                    insertCurrentVersion(request)));
            case APPEND -> List.of(appendAll(request));
        };
    }
}
