package com.sitesearch.store;

import java.util.*;

/**
 * Storage of one dataset in the in-memory store: its schema and its rows.
 * Object ids are assigned on insert and never reused.
 */
public class Dataset {
    private final DatasetPath path;
    private final DatasetKind kind;
    private final List<Field> fields = new ArrayList<>();
    private final List<Row> rows = new ArrayList<>();
    private long nextObjectId = 1;

    Dataset(DatasetPath path, DatasetKind kind) {
        this.path = path;
        this.kind = kind;
        fields.add(Field.objectId());
        if (kind == DatasetKind.FEATURE_CLASS) {
            fields.add(Field.shape());
        }
    }

    public DatasetPath getPath() {
        return path;
    }

    public DatasetKind getKind() {
        return kind;
    }

    public synchronized FieldList getFields() {
        return new FieldList(fields);
    }

    public synchronized boolean hasField(String name) {
        return getFields().findField(name) != null;
    }

    public synchronized void addField(Field field) throws FeatureStoreException {
        if (hasField(field.getName())) {
            throw new FeatureStoreException("Field " + field.getName() + " already exists in " + path);
        }
        fields.add(field);
    }

    public synchronized void deleteField(String name) throws FeatureStoreException {
        FieldList current = getFields();
        int index = current.indexOf(name);
        if (index < 0) {
            throw new FeatureStoreException("Field " + name + " does not exist in " + path);
        }
        Field field = current.get(index);
        if (field.isRequired()) {
            throw new FeatureStoreException("Cannot delete required field " + field.getName());
        }
        fields.remove(index);
        for (Row row : rows) {
            row.remove(field.getName());
        }
    }

    /**
     * Insert a copy of the given values under a fresh object id.
     */
    public synchronized Row addRow(Row values) {
        Row row = values.copy();
        row.set(Field.OBJECT_ID, nextObjectId++);
        if (kind == DatasetKind.TABLE) {
            row.remove(Field.SHAPE);
        }
        rows.add(row);
        return row;
    }

    /**
     * Copy of the row list. The rows themselves are live and may be updated in place.
     */
    public synchronized List<Row> getRows() {
        return new ArrayList<>(rows);
    }

    public synchronized int getRowCount() {
        return rows.size();
    }

    @Override
    public String toString() {
        return path + " [" + kind + ", " + rows.size() + " rows]";
    }
}
