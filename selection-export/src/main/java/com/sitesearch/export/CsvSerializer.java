package com.sitesearch.export;

import com.sitesearch.store.*;
import com.sitesearch.util.LoggingUtil;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes dataset rows as comma separated text.
 *
 * Values containing a comma are wrapped in double quotes. Embedded quotes are not
 * escaped, so a value holding both a comma and a quote does not read back cleanly.
 */
public class CsvSerializer {
    private final FeatureStore store;
    private final SchemaValidator validator;
    private final FieldProjector projector;
    private final TableSorter sorter;

    public CsvSerializer(FeatureStore store, SchemaValidator validator, FieldProjector projector, TableSorter sorter) {
        this.store = store;
        this.validator = validator;
        this.projector = projector;
        this.sorter = sorter;
    }

    /**
     * Copy rows of a table or feature class to a text file.
     *
     * @param inTable full path of the input dataset, or the name of a loaded layer or table
     * @param outPath text file to write
     * @param columns output columns; unknown names are dropped
     * @param orderColumns columns to sort by, may be empty
     * @param append add to the end of the file instead of replacing it (no header is written)
     * @param excludeHeader leave out the header line
     * @return rows written, 0 when no columns remain, -1 on failure
     */
    public int copyToCsv(String inTable, String outPath, String columns, String orderColumns,
                         boolean append, boolean excludeHeader) {
        if (!validator.inputExists(inTable)) {
            LoggingUtil.error("Cannot find input table " + inTable);
            return -1;
        }

        FieldList fields;
        try {
            fields = store.getFields(inTable);
        } catch (DatasetNotFoundException e) {
            LoggingUtil.error("Cannot read fields of " + inTable + ": " + e.getMessage());
            return -1;
        }

        Projection projection = projector.project(columns, fields, inTable);
        if (projection.isEmpty()) {
            LoggingUtil.warn("No columns to write to " + outPath);
            return 0;
        }

        Path output = Paths.get(outPath);
        StandardOpenOption[] options = append
                ? new StandardOpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                : new StandardOpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE};

        int rowCount = 0;
        try (RowCursor cursor = sorter.sort(store.search(inTable), orderColumns);
             BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8, options)) {

            if (!append && !excludeHeader) {
                writer.write(projection.getCleanedSpec());
                writer.newLine();
            }

            while (cursor.hasNext()) {
                Row row = cursor.next();
                List<String> values = new ArrayList<>();
                for (String token : projection.getTokens()) {
                    values.add(formatToken(token, row, cursor));
                }
                writer.write(String.join(",", values));
                writer.newLine();
                rowCount++;
            }
        } catch (IOException e) {
            LoggingUtil.error("Error writing to " + outPath + ": " + e.getMessage(), e);
            return -1;
        } catch (DatasetNotFoundException e) {
            LoggingUtil.error("Cannot read " + inTable + ": " + e.getMessage());
            return -1;
        }

        LoggingUtil.debug(rowCount + " rows written to " + outPath);
        return rowCount;
    }

    static String formatToken(String token, Row row, RowCursor cursor) {
        if (ColumnSpec.isLiteral(token)) {
            return token;
        }
        return formatValue(token, cursor.getValue(row, token));
    }

    /**
     * Text for one value. Distances are truncated to whole units.
     */
    static String formatValue(String column, Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number) {
            if (DerivedFieldCalculator.DISTANCE_FIELD.equals(column)) {
                return Long.toString((long) ((Number) value).doubleValue());
            }
            return Values.toText(value);
        }
        String text = Values.toText(value);
        if (value instanceof String && text.contains(",")) {
            return "\"" + text + "\"";
        }
        return text;
    }

    /**
     * Create or overwrite a file holding just a header line.
     */
    public boolean writeEmptyCsv(String outPath, String header) {
        Path output = Paths.get(outPath);
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            writer.write(header == null ? "" : header);
            writer.newLine();
            return true;
        } catch (IOException e) {
            LoggingUtil.error("Error writing to " + outPath + ": " + e.getMessage(), e);
            return false;
        }
    }
}
