package com.di.ingestion.load.merge;

import com.di.ingestion.load.ScdColumns;
import com.di.ingestion.sql.SqlExpr;
import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.SqlStatement.Assignment;

import java.util.ArrayList;
import java.util.List;

import static com.di.ingestion.sql.SqlExpr.col;

/**
 * Building blocks shared by the merge policies.
 */
final class MergeStatements {

    static final String TARGET = "TGT";
    static final String SOURCE = "SRC";

    private MergeStatements() {}

    /** Equality on every key column. */
    static SqlExpr keyMatch(List<String> keyColumns) {
        return SqlExpr.and(keyColumns.stream()
                .map(k -> SqlExpr.eq(col(TARGET, k), col(SOURCE, k)))
                .toList());
    }

    /** Null-aware "any non-key column differs"; constant FALSE when there is nothing to compare. */
    static SqlExpr anyColumnDiffers(List<String> nonKeyColumns) {
        if (nonKeyColumns.isEmpty()) {
            return SqlExpr.literal(Boolean.FALSE);
        }
        return SqlExpr.or(nonKeyColumns.stream()
                .map(c -> SqlExpr.distinctFrom(col(TARGET, c), col(SOURCE, c)))
                .toList());
    }

    static SqlExpr targetIsCurrent(ScdColumns scd) {
        return SqlExpr.eq(col(TARGET, scd.currentFlag()), SqlExpr.literal(Boolean.TRUE));
    }

    /** {@code col = SRC.col} for each column. */
    static List<Assignment> copyFromSource(List<String> columns) {
        return columns.stream()
                .map(c -> new Assignment(c, col(SOURCE, c)))
                .toList();
    }

    /** Marks the matched row as history: flag FALSE, end-date now. */
    static List<Assignment> close(ScdColumns scd) {
        return List.of(
                new Assignment(scd.currentFlag(), SqlExpr.literal(Boolean.FALSE)),
                new Assignment(scd.endDate(), SqlExpr.now()));
    }

    static List<Assignment> concat(List<Assignment> first, List<Assignment> second) {
        List<Assignment> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    /** Target columns of a new current version: business columns + flag, start, end. */
    static List<String> versionColumns(List<String> columns, ScdColumns scd) {
        List<String> all = new ArrayList<>(columns);
        all.add(scd.currentFlag());
        all.add(scd.startDate());
        all.add(scd.endDate());
        return all;
    }

    /** Values of a new current version: source columns + TRUE, now, NULL. */
    static List<SqlExpr> versionValues(List<String> columns) {
        List<SqlExpr> values = new ArrayList<>(columns.size() + 3);
        columns.forEach(c -> values.add(col(SOURCE, c)));
        values.add(SqlExpr.literal(Boolean.TRUE));
        values.add(SqlExpr.now());
        values.add(SqlExpr.nullValue());
        return values;
    }

    static SqlStatement.WhenNotMatchedInsert insertCurrentVersion(MergeRequest request) {
        return new SqlStatement.WhenNotMatchedInsert(
                versionColumns(request.columns(), request.scd()),
                versionValues(request.columns()));
    }

    /** Plain append of every source row as a new current version. */
    static SqlStatement.InsertSelect appendAll(MergeRequest request) {
        return new SqlStatement.InsertSelect(
                request.destination(),
                versionColumns(request.columns(), request.scd()),
                request.source(),
                SOURCE,
                versionValues(request.columns()));
    }

    static SqlStatement.Merge merge(MergeRequest request,
                                    SqlExpr on,
                                    List<SqlStatement.WhenMatchedUpdate> whenMatched,
                                    SqlStatement.WhenNotMatchedInsert whenNotMatched) {
        return new SqlStatement.Merge(request.destination(), TARGET, request.source(), SOURCE,
                                      on, whenMatched, whenNotMatched);
    }
}
