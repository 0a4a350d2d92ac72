package com.sitesearch.store;

/**
 * Storage type of a dataset field.
 */
public enum FieldType {
    STRING,
    INTEGER,
    DOUBLE,
    DATE,
    GEOMETRY,
    OTHER;

    public boolean isNumeric() {
        return this == INTEGER || this == DOUBLE;
    }

    /**
     * Resolve a type keyword as used by the add-field operation (TEXT, LONG, SHORT, FLOAT, ...).
     */
    public static FieldType fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        switch (name.trim().toUpperCase()) {
            case "STRING":
            case "TEXT":
                return STRING;
            case "INTEGER":
            case "LONG":
            case "SHORT":
                return INTEGER;
            case "DOUBLE":
            case "FLOAT":
                return DOUBLE;
            case "DATE":
                return DATE;
            case "GEOMETRY":
                return GEOMETRY;
            default:
                return OTHER;
        }
    }
}
