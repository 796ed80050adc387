package com.di.ingestion.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal expression tree used by the statement model.
 *
 * <p>Only the shapes the ingestion pipeline needs are modelled: column
 * references, literals, the engine clock, equality, null-aware
 * {@code IS DISTINCT FROM} and AND/OR junctions. Dialects render them;
 * nothing here ever concatenates raw SQL.
 */
public interface SqlExpr {

    /** Column reference, optionally qualified by a table alias. */
    record Column(String qualifier, String name) implements SqlExpr {}

    /** {@code null}, {@link Boolean}, {@link Number} or {@link String}. */
    record Literal(Object value) implements SqlExpr {}

    /** The engine's current timestamp at statement execution. */
    record CurrentTimestamp() implements SqlExpr {}

    record Comparison(SqlExpr left, Operator operator, SqlExpr right) implements SqlExpr {}

    record Junction(Connective connective, List<SqlExpr> terms) implements SqlExpr {
        public Junction {
            if (terms == null || terms.isEmpty()) {
                throw new IllegalArgumentException("Junction requires at least one term");
            }
            terms = List.copyOf(terms);
        }
    }

    enum Operator {
        EQ,
        /** Null-aware inequality: NULL is not distinct from NULL. */
        DISTINCT_FROM
    }

    enum Connective { AND, OR }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    static Column col(String qualifier, String name) {
        return new Column(qualifier, name);
    }

    static Literal literal(Object value) {
        return new Literal(value);
    }

    static Literal nullValue() {
        return new Literal(null);
    }

    static CurrentTimestamp now() {
        return new CurrentTimestamp();
    }

    static Comparison eq(SqlExpr left, SqlExpr right) {
        return new Comparison(left, Operator.EQ, right);
    }

    static Comparison distinctFrom(SqlExpr left, SqlExpr right) {
        return new Comparison(left, Operator.DISTINCT_FROM, right);
    }

    static SqlExpr and(List<? extends SqlExpr> terms) {
        return terms.size() == 1 ? terms.get(0) : new Junction(Connective.AND, new ArrayList<>(terms));
    }

    static SqlExpr and(SqlExpr... terms) {
        return and(List.of(terms));
    }

    static SqlExpr or(List<? extends SqlExpr> terms) {
        return terms.size() == 1 ? terms.get(0) : new Junction(Connective.OR, new ArrayList<>(terms));
    }
}
