package com.di.ingestion.sql;

import com.di.ingestion.sql.SqlStatement.AddColumn;
import com.di.ingestion.sql.SqlStatement.Assignment;
import com.di.ingestion.sql.SqlStatement.CopyInto;
import com.di.ingestion.sql.SqlStatement.CountRows;
import com.di.ingestion.sql.SqlStatement.CreateDedupTable;
import com.di.ingestion.sql.SqlStatement.CreateTable;
import com.di.ingestion.sql.SqlStatement.InsertSelect;
import com.di.ingestion.sql.SqlStatement.ListStageFiles;
import com.di.ingestion.sql.SqlStatement.Merge;
import com.di.ingestion.sql.SqlStatement.WhenMatchedUpdate;
import com.di.ingestion.sql.SqlStatement.WhenNotMatchedInsert;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Snowflake rendering of the statement model.
 *
 * <p>Catalog-supplied values never reach the SQL text unchecked:
 * <ul>
 *   <li>identifiers outside {@code [A-Za-z_][A-Za-z0-9_$]*} are double-quoted with escaping;</li>
 *   <li>data types, stage locations, file format names and error policies must match
 *       strict patterns or an {@link IllegalArgumentException} is raised;</li>
 *   <li>string literals are single-quote escaped.</li>
 * </ul>
 */
@Component
public class SnowflakeDialect implements SqlDialect {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
    private static final Pattern DATA_TYPE =
            Pattern.compile("[A-Za-z][A-Za-z0-9_ ]*(\\(\\s*\\d+\\s*(,\\s*\\d+\\s*)?\\))?");
    private static final Pattern STAGE_LOCATION = Pattern.compile("@[^\\s;'()]+");
    private static final Pattern FILE_FORMAT =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*){0,2}");
    private static final Pattern ON_ERROR = Pattern.compile("[A-Za-z0-9_%]+");

    @Override
    public String name() {
        return "snowflake";
    }

    @Override
    public String render(SqlStatement statement) {
        if (statement instanceof CreateTable s)      return renderCreateTable(s);
        if (statement instanceof AddColumn s)        return renderAddColumn(s);
        if (statement instanceof ListStageFiles s)   return "LIST " + stage(s.stageLocation());
        if (statement instanceof CopyInto s)         return renderCopyInto(s);
        if (statement instanceof CreateDedupTable s) return renderDedup(s);
        if (statement instanceof Merge s)            return renderMerge(s);
        if (statement instanceof InsertSelect s)     return renderInsertSelect(s);
        if (statement instanceof CountRows s)        return "SELECT COUNT(*) FROM " + renderTable(s.table());
        throw new IllegalArgumentException("Unsupported statement: " + statement.kind());
    }

    @Override
    public String renderLastResult() {
        return "SELECT * FROM TABLE(RESULT_SCAN(LAST_QUERY_ID()))";
    }

    @Override
    public String renderTable(TableRef table) {
        return table.parts().stream().map(this::quoteIdentifier).collect(Collectors.joining("."));
    }

    @Override
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        if (PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private String renderCreateTable(CreateTable s) {
        String prefix = s.mode() == SqlStatement.CreateMode.OR_REPLACE
                ? "CREATE OR REPLACE TABLE "
                : "CREATE TABLE IF NOT EXISTS ";
        String columns = s.columns().stream().map(this::columnDefinition).collect(Collectors.joining(", "));
        return prefix + renderTable(s.table()) + " (" + columns + ")";
    }

    private String renderAddColumn(AddColumn s) {
        return "ALTER TABLE " + renderTable(s.table()) + " ADD COLUMN " + columnDefinition(s.column());
    }

    private String renderCopyInto(CopyInto s) {
        String projections = s.sourcePositions().stream()
                .map(p -> {
                    if (p == null || p < 1) {
                        throw new IllegalArgumentException("Source position must be >= 1, got " + p);
                    }
                    return "$" + p;
                })
                .collect(Collectors.joining(", "));
        return "COPY INTO " + renderTable(s.table())
                + " (" + identifiers(s.columns()) + ")"
                + " FROM (SELECT " + projections + " FROM " + stage(s.stageLocation()) + ")"
                + " FILE_FORMAT = (FORMAT_NAME = '" + fileFormat(s.fileFormat()) + "')"
                + " ON_ERROR = '" + onError(s.onError()) + "'";
    }

    private String renderDedup(CreateDedupTable s) {
        StringBuilder sql = new StringBuilder()
                .append("CREATE OR REPLACE TABLE ").append(renderTable(s.table()))
                .append(" AS SELECT * FROM ").append(renderTable(s.source()))
                .append(" QUALIFY ROW_NUMBER() OVER (PARTITION BY ").append(identifiers(s.partitionBy()));
        if (!s.orderBy().isEmpty()) {
            sql.append(" ORDER BY ").append(s.orderBy().stream()
                    .map(this::orderTerm)
                    .collect(Collectors.joining(", ")));
        }
        return sql.append(") = 1").toString();
    }

    private String renderMerge(Merge s) {
        StringBuilder sql = new StringBuilder()
                .append("MERGE INTO ").append(renderTable(s.target())).append(" AS ").append(quoteIdentifier(s.targetAlias()))
                .append(" USING ").append(renderTable(s.source())).append(" AS ").append(quoteIdentifier(s.sourceAlias()))
                .append(" ON ").append(expr(s.on()));
        for (WhenMatchedUpdate clause : s.whenMatched()) {
            sql.append(" WHEN MATCHED");
            if (clause.condition() != null) {
                sql.append(" AND ").append(expr(clause.condition()));
            }
            sql.append(" THEN UPDATE SET ").append(assignments(clause.assignments()));
        }
        WhenNotMatchedInsert insert = s.whenNotMatched();
        if (insert != null) {
            sql.append(" WHEN NOT MATCHED THEN INSERT (").append(identifiers(insert.columns()))
               .append(") VALUES (").append(expressions(insert.values())).append(")");
        }
        return sql.toString();
    }

    private String renderInsertSelect(InsertSelect s) {
        return "INSERT INTO " + renderTable(s.target())
                + " (" + identifiers(s.columns()) + ")"
                + " SELECT " + expressions(s.values())
                + " FROM " + renderTable(s.source()) + " AS " + quoteIdentifier(s.sourceAlias());
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    String expr(SqlExpr e) {
        if (e instanceof SqlExpr.Column c) {
            return c.qualifier() == null
                    ? quoteIdentifier(c.name())
                    : quoteIdentifier(c.qualifier()) + "." + quoteIdentifier(c.name());
        }
        if (e instanceof SqlExpr.Literal l) {
            return literal(l.value());
        }
        if (e instanceof SqlExpr.CurrentTimestamp) {
            return "CURRENT_TIMESTAMP()";
        }
        if (e instanceof SqlExpr.Comparison c) {
            String op = c.operator() == SqlExpr.Operator.EQ ? " = " : " IS DISTINCT FROM ";
            return expr(c.left()) + op + expr(c.right());
        }
        if (e instanceof SqlExpr.Junction j) {
            String glue = " " + j.connective().name() + " ";
            return "(" + j.terms().stream().map(this::expr).collect(Collectors.joining(glue)) + ")";
        }
        throw new IllegalArgumentException("Unsupported expression: " + e);
    }

    private String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof Number n) {
            if (n instanceof Double d && (d.isNaN() || d.isInfinite())) {
                throw new IllegalArgumentException("Non-finite numeric literal: " + d);
            }
            return n.toString();
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    private String orderTerm(OrderTerm term) {
        return expr(term.expression())
                + (term.descending() ? " DESC" : " ASC")
                + (term.nullsLast() ? " NULLS LAST" : " NULLS FIRST");
    }

    private String assignments(List<Assignment> assignments) {
        return assignments.stream()
                .map(a -> quoteIdentifier(a.column()) + " = " + expr(a.value()))
                .collect(Collectors.joining(", "));
    }

    private String expressions(List<SqlExpr> values) {
        return values.stream().map(this::expr).collect(Collectors.joining(", "));
    }

    private String identifiers(List<String> names) {
        return names.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }

    private String columnDefinition(ColumnDef column) {
        StringBuilder sql = new StringBuilder(quoteIdentifier(column.name()))
                .append(' ').append(dataType(column.dataType()));
        if (column.defaultValue() != null) {
            sql.append(" DEFAULT ").append(expr(column.defaultValue()));
        }
        return sql.toString();
    }

    // ------------------------------------------------------------------
    // Validation of catalog-supplied fragments
    // ------------------------------------------------------------------

    private static String dataType(String type) {
        return requireMatch(DATA_TYPE, type == null ? null : type.trim(), "data type");
    }

    private static String stage(String location) {
        return requireMatch(STAGE_LOCATION, location == null ? null : location.trim(), "stage location");
    }

    private static String fileFormat(String format) {
        return requireMatch(FILE_FORMAT, format == null ? null : format.trim(), "file format");
    }

    private static String onError(String policy) {
        return requireMatch(ON_ERROR, policy, "ON_ERROR policy");
    }

    private static String requireMatch(Pattern pattern, String value, String what) {
        if (value == null || !pattern.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + value + "'");
        }
        return value;
    }
}
