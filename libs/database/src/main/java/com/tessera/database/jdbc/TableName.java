package com.tessera.database.jdbc;

import java.util.regex.Pattern;

/** Checks table names before they are spliced into SQL. */
public final class TableName {

    /** Longest identifier PostgreSQL keeps without truncating. */
    public static final int MAX_LENGTH = 63;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private TableName() {}

    /**
     * Returns the name if it is a plain, unquoted SQL identifier.
     *
     * @throws IllegalArgumentException otherwise
     */
    public static String require(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("table name must not be null or blank");
        }
        if (name.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "table name '%s' is longer than %d characters".formatted(name, MAX_LENGTH));
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "table name '%s' must start with a letter or underscore and contain only letters, digits and underscores"
                            .formatted(name));
        }
        if (name.toLowerCase().startsWith("pg_")) {
            throw new IllegalArgumentException("table name '%s' uses the reserved pg_ prefix".formatted(name));
        }
        return name;
    }
}
