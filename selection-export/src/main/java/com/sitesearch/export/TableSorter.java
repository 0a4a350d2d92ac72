package com.sitesearch.export;

import com.sitesearch.store.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders cursor rows by the order columns that exist in the cursor's fields.
 * Sorting is ascending with nulls first and reads every row before returning.
 */
public class TableSorter {
    private final SchemaValidator validator;

    public TableSorter(SchemaValidator validator) {
        this.validator = validator;
    }

    public RowCursor sort(RowCursor cursor, String orderSpec) {
        List<String> columns = new ArrayList<>();
        for (String column : ColumnSpec.splitColumns(orderSpec)) {
            if (!ColumnSpec.isLiteral(column) && validator.fieldExists(cursor.getFields(), column)) {
                columns.add(column);
            }
        }
        if (columns.isEmpty()) {
            return cursor;
        }

        List<Row> rows = new ArrayList<>();
        while (cursor.hasNext()) {
            rows.add(cursor.next());
        }
        cursor.close();

        Comparator<Row> comparator = null;
        for (String column : columns) {
            Comparator<Row> next = (a, b) -> Values.compare(cursor.getValue(a, column), cursor.getValue(b, column));
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        rows.sort(comparator);
        return new RowCursor(cursor.getFields(), rows);
    }
}
