package com.sitesearch.store;

import org.locationtech.jts.geom.Geometry;

import java.util.Map;
import java.util.TreeMap;

/**
 * One record of a dataset. Values are keyed by field name, case-insensitively.
 */
public class Row {
    private final Map<String, Object> values = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public Row() {
    }

    public Row(Map<String, Object> initial) {
        values.putAll(initial);
    }

    public Object get(String fieldName) {
        return values.get(fieldName);
    }

    public void set(String fieldName, Object value) {
        values.put(fieldName, value);
    }

    public void remove(String fieldName) {
        values.remove(fieldName);
    }

    public long getObjectId() {
        Object id = values.get(Field.OBJECT_ID);
        return id instanceof Number ? ((Number) id).longValue() : -1L;
    }

    public Geometry getShape() {
        Object shape = values.get(Field.SHAPE);
        return shape instanceof Geometry ? (Geometry) shape : null;
    }

    public Row copy() {
        return new Row(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
