package com.di.ingestion.sql;

/**
 * Column definition for {@code CREATE TABLE} / {@code ADD COLUMN}.
 *
 * @param defaultValue optional {@code DEFAULT} expression, {@code null} for none
 */
public record ColumnDef(String name, String dataType, SqlExpr defaultValue) {

    public static ColumnDef of(String name, String dataType) {
        return new ColumnDef(name, dataType, null);
    }
}
