package com.di.ingestion.load.merge;

import com.di.ingestion.load.ScdColumns;
import com.di.ingestion.sql.SqlExpr;
import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.SqlStatement.WhenMatchedUpdate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.di.ingestion.load.merge.MergeStatements.*;

/**
 * Two-step SCD Type 2 merge: close the superseded current version, then
 * insert a new current version for every source row whose key has no
 * current row left.
 *
 * <p>Leaves the old values untouched on the closed row, so the destination
 * keeps full history and at most one current row per key.
 *
 * <ol>
 *   <li>Close: {@code MERGE ... ON keys WHEN MATCHED AND current [AND changed]
 *       THEN UPDATE SET flag = FALSE, end = now}. FULL and INCREMENTAL only close
 *       changed rows; BULK closes every matched current row.</li>
 *   <li>Insert: {@code MERGE ... ON keys AND current WHEN NOT MATCHED THEN INSERT}.</li>
 * </ol>
 * APPEND is a plain insert as in {@link InPlaceMergePolicy}.
 */
@Component
@ConditionalOnProperty(name = "ingestion.merge.versioning", havingValue = "CLOSE_AND_INSERT")
public class CloseAndInsertMergePolicy implements MergePolicy {

    public static final String NAME = "CLOSE_AND_INSERT";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SqlStatement> plan(MergeRequest request) {
        ScdColumns scd = request.scd();
        SqlExpr keys = keyMatch(request.keyColumns());

        SqlExpr closeWhen = switch (request.loadType()) {
            case FULL, INCREMENTAL -> SqlExpr.and(targetIsCurrent(scd), anyColumnDiffers(request.nonKeyColumns()));
            case BULK -> targetIsCurrent(scd);
            case APPEND -> null;
        };
        if (closeWhen == null) {
            return List.of(appendAll(request));
        }

        List<SqlStatement> statements = new ArrayList<>(2);
        statements.add(merge(request, keys,
                List.of(new WhenMatchedUpdate(closeWhen, close(scd))),
                null));
        statements.add(merge(request, SqlExpr.and(keys, targetIsCurrent(scd)),
                List.of(),
                insertCurrentVersion(request)));
        return statements;
    }
}
