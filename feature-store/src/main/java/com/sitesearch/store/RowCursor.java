package com.sitesearch.store;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only cursor over a snapshot of rows, carrying the field list it was opened with.
 */
public class RowCursor implements Iterator<Row>, AutoCloseable {
    private final FieldList fields;
    private final Iterator<Row> rows;
    private boolean closed = false;

    public RowCursor(FieldList fields, List<Row> rows) {
        this.fields = fields;
        this.rows = rows.iterator();
    }

    public FieldList getFields() {
        return fields;
    }

    /**
     * Read a column from a row, resolving the column by field name first and by alias second.
     */
    public Object getValue(Row row, String column) {
        Field field = fields.findField(column);
        if (field == null) {
            field = fields.findFieldByAlias(column);
        }
        return field == null ? null : row.get(field.getName());
    }

    @Override
    public boolean hasNext() {
        return !closed && rows.hasNext();
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return rows.next();
    }

    @Override
    public void close() {
        closed = true;
    }
}
