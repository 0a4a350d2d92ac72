package com.sitesearch.store;

/**
 * Definition of a single dataset field.
 */
public class Field {
    public static final String OBJECT_ID = "OBJECTID";
    public static final String SHAPE = "Shape";

    private final String name;
    private final String alias;
    private final FieldType type;
    private final int length;
    private final boolean required;

    public Field(String name, FieldType type, int length) {
        this(name, name, type, length, false);
    }

    public Field(String name, String alias, FieldType type, int length, boolean required) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Field name is required");
        }
        this.name = name;
        this.alias = alias == null ? name : alias;
        this.type = type;
        this.length = length;
        this.required = required;
    }

    public static Field objectId() {
        return new Field(OBJECT_ID, OBJECT_ID, FieldType.INTEGER, 0, true);
    }

    public static Field shape() {
        return new Field(SHAPE, SHAPE, FieldType.GEOMETRY, 0, true);
    }

    /**
     * Copy of this definition under another name, never required.
     */
    public Field renamed(String newName) {
        return new Field(newName, newName, type, length, false);
    }

    public String getName() {
        return name;
    }

    public String getAlias() {
        return alias;
    }

    public FieldType getType() {
        return type;
    }

    public int getLength() {
        return length;
    }

    public boolean isRequired() {
        return required;
    }

    @Override
    public String toString() {
        return name + " (" + type + (length > 0 ? ", " + length : "") + ")";
    }
}
