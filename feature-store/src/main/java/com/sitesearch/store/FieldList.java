package com.sitesearch.store;

import java.util.*;

/**
 * Ordered, read-only snapshot of a dataset's fields.
 * Name lookups are case-insensitive.
 */
public class FieldList implements Iterable<Field> {
    private final List<Field> fields;

    public FieldList(List<Field> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Field get(int index) {
        return fields.get(index);
    }

    public Field findField(String name) {
        int index = indexOf(name);
        return index < 0 ? null : fields.get(index);
    }

    public Field findFieldByAlias(String alias) {
        if (alias == null) {
            return null;
        }
        for (Field field : fields) {
            if (field.getAlias().equalsIgnoreCase(alias)) {
                return field;
            }
        }
        return null;
    }

    public int indexOf(String name) {
        if (name == null) {
            return -1;
        }
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>();
        for (Field field : fields) {
            names.add(field.getName());
        }
        return names;
    }

    public List<Field> asList() {
        return fields;
    }

    @Override
    public Iterator<Field> iterator() {
        return fields.iterator();
    }

    @Override
    public String toString() {
        return getNames().toString();
    }
}
