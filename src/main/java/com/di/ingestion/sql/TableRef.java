package com.di.ingestion.sql;

import com.di.ingestion.config.WarehouseContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Fully resolved {@code database.schema.table} identifier.
 *
 * <p>Catalog rows may carry a bare table name, a {@code SCHEMA.TABLE} pair or a
 * fully qualified name; {@link #resolve} fills whatever is missing from the
 * {@link WarehouseContext} of the current run.
 */
public record TableRef(String database, String schema, String name) {

    public TableRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
    }

    public static TableRef of(String database, String schema, String name) {
        return new TableRef(database, schema, name);
    }

    /**
     * Resolves a possibly partial identifier against the run context.
     *
     * @param identifier {@code TABLE}, {@code SCHEMA.TABLE} or {@code DB.SCHEMA.TABLE}
     * @param ctx        supplies the default database and schema
     */
    public static TableRef resolve(String identifier, WarehouseContext ctx) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Table identifier must not be blank");
        }
        String[] parts = identifier.trim().split("\\.", -1);
        for (String part : parts) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("Table identifier has an empty part: '" + identifier + "'");
            }
        }
        return switch (parts.length) {
            case 1 -> new TableRef(ctx.database(), ctx.schema(), parts[0].trim());
            case 2 -> new TableRef(ctx.database(), parts[0].trim(), parts[1].trim());
            case 3 -> new TableRef(parts[0].trim(), parts[1].trim(), parts[2].trim());
            default -> throw new IllegalArgumentException(
                    "Table identifier has too many parts: '" + identifier + "'");
        };
    }

    /** Same database/schema, different table name. */
    public TableRef withName(String newName) {
        return new TableRef(database, schema, newName);
    }

    /** Same database and table name, placed in another schema. */
    public TableRef inSchema(String newSchema) {
        return new TableRef(database, newSchema, name);
    }

    /** Non-null identifier parts in order, for dialect rendering. */
    public List<String> parts() {
        List<String> parts = new ArrayList<>(3);
        if (database != null && !database.isBlank()) parts.add(database);
        if (schema != null && !schema.isBlank()) parts.add(schema);
        parts.add(name);
        return parts;
    }

    @Override
    public String toString() {
        return String.join(".", parts());
    }
}
