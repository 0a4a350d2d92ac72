package com.sitesearch.store;

import com.sitesearch.util.LoggingUtil;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a delimited text file into the in-memory store. One column holds the geometry as
 * WKT; the remaining columns become attribute fields whose type is inferred from the data
 * (INTEGER, DOUBLE, otherwise STRING). Without a geometry column the result is a table.
 */
public class WktCsvLoader {
    public static final String DEFAULT_GEOMETRY_COLUMN = "WKT";

    private final InMemoryFeatureStore store;
    private final WKTReader reader = new WKTReader();

    public WktCsvLoader(InMemoryFeatureStore store) {
        this.store = store;
    }

    public Dataset load(Path csvFile, DatasetPath target) throws IOException, FeatureStoreException {
        return load(csvFile, target, DEFAULT_GEOMETRY_COLUMN);
    }

    public Dataset load(Path csvFile, DatasetPath target, String geometryColumn)
            throws IOException, FeatureStoreException {
        LoggingUtil.info("Loading " + csvFile + " into " + target);
        List<String> lines = Files.readAllLines(csvFile, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            throw new IOException("File is empty: " + csvFile);
        }

        // Remove BOM if present
        String headerLine = lines.get(0);
        if (headerLine.length() > 0 && headerLine.charAt(0) == '\uFEFF') {
            headerLine = headerLine.substring(1);
            LoggingUtil.debug("Removed BOM from header line");
        }
        String[] headers = parseRow(headerLine);

        List<String[]> data = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            if (lines.get(i).trim().isEmpty()) {
                continue;
            }
            String[] values = parseRow(lines.get(i));
            if (values.length > headers.length) {
                throw new IOException("Line " + (i + 1) + " of " + csvFile + " has " + values.length
                        + " values but the header has " + headers.length);
            }
            data.add(values);
        }

        int geometryIndex = -1;
        List<Field> fields = new ArrayList<>();
        Field[] columnFields = new Field[headers.length];
        for (int c = 0; c < headers.length; c++) {
            if (headers[c].equalsIgnoreCase(geometryColumn)) {
                geometryIndex = c;
                continue;
            }
            if (headers[c].equalsIgnoreCase(Field.OBJECT_ID)) {
                continue;
            }
            columnFields[c] = inferField(headers[c], data, c);
            fields.add(columnFields[c]);
        }

        DatasetKind kind = geometryIndex >= 0 ? DatasetKind.FEATURE_CLASS : DatasetKind.TABLE;
        Dataset dataset = store.createDataset(target, kind, fields);
        for (String[] values : data) {
            Row row = new Row();
            for (int c = 0; c < values.length; c++) {
                if (c == geometryIndex) {
                    row.set(Field.SHAPE, readGeometry(values[c], csvFile));
                } else if (columnFields[c] != null) {
                    row.set(columnFields[c].getName(), convert(values[c], columnFields[c].getType()));
                }
            }
            dataset.addRow(row);
        }
        LoggingUtil.info("Loaded " + data.size() + " rows into " + target);
        return dataset;
    }

    private Geometry readGeometry(String wkt, Path csvFile) throws IOException {
        if (wkt.isEmpty()) {
            return null;
        }
        try {
            return reader.read(wkt);
        } catch (ParseException e) {
            throw new IOException("Invalid geometry in " + csvFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Narrowest type that every non-empty value of the column parses as.
     */
    static Field inferField(String name, List<String[]> data, int column) {
        boolean allLong = true;
        boolean allDouble = true;
        int maxLength = 1;
        for (String[] values : data) {
            String value = column < values.length ? values[column] : "";
            if (value.isEmpty()) {
                continue;
            }
            maxLength = Math.max(maxLength, value.length());
            if (allLong) {
                try {
                    Long.parseLong(value);
                } catch (NumberFormatException e) {
                    allLong = false;
                }
            }
            if (allDouble) {
                try {
                    Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    allDouble = false;
                }
            }
        }
        if (allLong) {
            return new Field(name, FieldType.INTEGER, 0);
        }
        if (allDouble) {
            return new Field(name, FieldType.DOUBLE, 0);
        }
        return new Field(name, FieldType.STRING, Math.max(maxLength, 50));
    }

    private static Object convert(String value, FieldType type) {
        if (value.isEmpty()) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return Long.parseLong(value);
            case DOUBLE:
                return Double.parseDouble(value);
            default:
                return value;
        }
    }

    /**
     * Split one line on commas outside double quotes. Quotes are dropped, values trimmed,
     * and a trailing empty value is kept.
     */
    static String[] parseRow(String rowData) {
        List<String> values = new ArrayList<>();
        StringBuilder currentValue = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < rowData.length(); i++) {
            char c = rowData.charAt(i);

            if (c == '"') {
                inQuotes = !inQuotes;
                continue;
            }

            if (c == ',' && !inQuotes) {
                values.add(currentValue.toString().trim());
                currentValue = new StringBuilder();
                continue;
            }

            currentValue.append(c);
        }
        values.add(currentValue.toString().trim());

        return values.toArray(new String[0]);
    }
}
