package com.di.ingestion.sql;

/**
 * One {@code ORDER BY} term inside a window clause.
 */
public record OrderTerm(SqlExpr expression, boolean descending, boolean nullsLast) {

    public static OrderTerm asc(SqlExpr expression) {
        return new OrderTerm(expression, false, true);
    }

    public static OrderTerm descNullsLast(SqlExpr expression) {
        return new OrderTerm(expression, true, true);
    }
}
