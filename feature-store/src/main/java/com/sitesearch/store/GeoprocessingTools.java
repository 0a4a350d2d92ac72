package com.sitesearch.store;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.*;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Implementations of the engine operations for the in-memory store.
 * Runs on the store's worker thread; every failure surfaces as a FeatureStoreException.
 */
class GeoprocessingTools {

    private static final Pattern CONDITION =
            Pattern.compile("^\\s*\\[?(\\w+)\\]?\\s*(<>|>=|<=|=|>|<)\\s*(.+?)\\s*$");
    private static final Pattern INTEGER_LITERAL = Pattern.compile("^[-+]?\\d+$");

    private final InMemoryFeatureStore store;

    GeoprocessingTools(InMemoryFeatureStore store) {
        this.store = store;
    }

    void run(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        switch (request.getOperation()) {
            case COPY_FEATURES:
                copy(request, DatasetKind.FEATURE_CLASS, messages);
                break;
            case COPY_TABLE:
                copy(request, DatasetKind.TABLE, messages);
                break;
            case CLIP:
                clip(request, messages);
                break;
            case BUFFER:
                buffer(request, messages);
                break;
            case SELECT_BY_LOCATION:
                selectByLocation(request, messages);
                break;
            case SELECT_BY_ATTRIBUTE:
                selectByAttribute(request, messages);
                break;
            case SPATIAL_JOIN:
                spatialJoin(request, messages);
                break;
            case STATISTICS:
                statistics(request, messages);
                break;
            case DISSOLVE:
                dissolve(request, messages);
                break;
            case ADD_FIELD:
                addField(request, messages);
                break;
            case DELETE_FIELD:
                deleteField(request, messages);
                break;
            case CALCULATE_FIELD:
                calculateField(request, messages);
                break;
            case CALCULATE_GEOMETRY:
                calculateGeometry(request, messages);
                break;
            case DELETE:
                delete(request, messages);
                break;
            default:
                throw new FeatureStoreException("Unsupported operation " + request.getOperation());
        }
    }

    // Copy, clip and buffer

    private void copy(OperationRequest request, DatasetKind kind, Consumer<String> messages)
            throws FeatureStoreException {
        InMemoryFeatureStore.Source source = store.resolve(request.getParameter(0));
        if (kind == DatasetKind.FEATURE_CLASS && source.getDataset().getKind() != DatasetKind.FEATURE_CLASS) {
            throw new FeatureStoreException("Input " + request.getParameter(0) + " is not a feature class");
        }
        Dataset output = store.createDataset(outputPath(request, 1), kind, attributeFields(source.getFields()));
        List<Row> rows = source.getRows();
        for (Row row : rows) {
            output.addRow(row);
        }
        messages.accept("Copied " + rows.size() + " rows to " + output.getPath());
    }

    private void clip(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = requireFeatures(request.getParameter(0));
        InMemoryFeatureStore.Source clipSource = requireFeatures(request.getParameter(1));
        Geometry mask = union(clipSource.getRows());
        Dataset output = store.createDataset(outputPath(request, 2), DatasetKind.FEATURE_CLASS,
                attributeFields(source.getFields()));
        int count = 0;
        if (mask != null) {
            for (Row row : source.getRows()) {
                Geometry shape = row.getShape();
                if (shape == null || !shape.intersects(mask)) {
                    continue;
                }
                Geometry clipped = shape.intersection(mask);
                if (clipped.isEmpty()) {
                    continue;
                }
                Row copy = row.copy();
                copy.set(Field.SHAPE, clipped);
                output.addRow(copy);
                count++;
            }
        }
        messages.accept("Clipped " + count + " features to " + output.getPath());
    }

    private void buffer(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = requireFeatures(request.getParameter(0));
        double distance = parseDistance(request.getParameter(2));
        boolean dissolveAll = "ALL".equalsIgnoreCase(request.getParameter(3));

        if (dissolveAll) {
            Dataset output = store.createDataset(outputPath(request, 1), DatasetKind.FEATURE_CLASS,
                    Collections.emptyList());
            List<Geometry> buffers = new ArrayList<>();
            for (Row row : source.getRows()) {
                if (row.getShape() != null) {
                    buffers.add(row.getShape().buffer(distance));
                }
            }
            if (!buffers.isEmpty()) {
                Row row = new Row();
                row.set(Field.SHAPE, UnaryUnionOp.union(buffers));
                output.addRow(row);
            }
            messages.accept("Buffered " + buffers.size() + " features into one");
            return;
        }

        Dataset output = store.createDataset(outputPath(request, 1), DatasetKind.FEATURE_CLASS,
                attributeFields(source.getFields()));
        int count = 0;
        for (Row row : source.getRows()) {
            Row copy = row.copy();
            copy.set(Field.SHAPE, row.getShape() == null ? null : row.getShape().buffer(distance));
            output.addRow(copy);
            count++;
        }
        messages.accept("Buffered " + count + " features");
    }

    // Selection

    private void selectByLocation(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        String layerName = requireLayer(request.getParameter(0));
        Geometry mask = union(requireFeatures(request.getParameter(1)).getRows());
        boolean subset = "SUBSET_SELECTION".equalsIgnoreCase(request.getParameter(2));

        List<Long> selected = new ArrayList<>();
        if (mask != null) {
            for (Row row : candidates(layerName, subset)) {
                if (row.getShape() != null && row.getShape().intersects(mask)) {
                    selected.add(row.getObjectId());
                }
            }
        }
        store.getSession().setSelection(layerName, selected);
        messages.accept("Selected " + selected.size() + " features in " + layerName);
    }

    /**
     * Where clauses are one or more conditions joined by AND, each of the form
     * {@code Field op value} with op one of = <> < > <= >= and the value either a quoted
     * string or a number.
     */
    private void selectByAttribute(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        String layerName = requireLayer(request.getParameter(0));
        String method = request.getParameter(2);
        if ("CLEAR_SELECTION".equalsIgnoreCase(method)) {
            store.getSession().clearSelection(layerName);
            messages.accept("Cleared selection on " + layerName);
            return;
        }
        boolean subset = "SUBSET_SELECTION".equalsIgnoreCase(method);
        FieldList fields = store.resolve(layerName).getFields();

        List<String[]> conditions = new ArrayList<>();
        String clause = request.getParameter(1).trim();
        if (!clause.isEmpty()) {
            for (String part : clause.split("(?i)\\s+AND\\s+")) {
                Matcher matcher = CONDITION.matcher(part);
                if (!matcher.matches()) {
                    throw new FeatureStoreException("Invalid expression: " + clause);
                }
                Field field = fields.findField(matcher.group(1));
                if (field == null) {
                    throw new FeatureStoreException("Field " + matcher.group(1) + " does not exist in " + layerName);
                }
                conditions.add(new String[]{field.getName(), matcher.group(2), matcher.group(3)});
            }
        }

        List<Long> selected = new ArrayList<>();
        for (Row row : candidates(layerName, subset)) {
            boolean match = true;
            for (String[] condition : conditions) {
                if (!matches(row.get(condition[0]), condition[1], parseLiteral(condition[2]))) {
                    match = false;
                    break;
                }
            }
            if (match) {
                selected.add(row.getObjectId());
            }
        }
        store.getSession().setSelection(layerName, selected);
        messages.accept("Selected " + selected.size() + " records in " + layerName);
    }

    private List<Row> candidates(String layerName, boolean subset) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = store.resolve(layerName);
        return subset ? source.getRows() : source.getDataset().getRows();
    }

    private static boolean matches(Object value, String operator, Object literal) {
        if (value == null || literal == null) {
            return false;
        }
        int comparison;
        if (value instanceof Number && literal instanceof Number) {
            comparison = Double.compare(((Number) value).doubleValue(), ((Number) literal).doubleValue());
        } else {
            comparison = Values.toText(value).compareTo(Values.toText(literal));
        }
        switch (operator) {
            case "=":
                return comparison == 0;
            case "<>":
                return comparison != 0;
            case "<":
                return comparison < 0;
            case ">":
                return comparison > 0;
            case "<=":
                return comparison <= 0;
            default:
                return comparison >= 0;
        }
    }

    private static Object parseLiteral(String text) throws FeatureStoreException {
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text.substring(1, text.length() - 1).replace("''", "'");
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new FeatureStoreException("Invalid value in expression: " + text, e);
        }
    }

    // Spatial join

    private void spatialJoin(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        InMemoryFeatureStore.Source target = requireFeatures(request.getParameter(0));
        InMemoryFeatureStore.Source join = requireFeatures(request.getParameter(1));
        String joinOperation = request.getParameter(3);
        if (!joinOperation.isEmpty() && !"JOIN_ONE_TO_ONE".equalsIgnoreCase(joinOperation)) {
            throw new FeatureStoreException("Join operation " + joinOperation + " is not supported");
        }
        boolean keepAll = !"KEEP_COMMON".equalsIgnoreCase(request.getParameter(4));
        String matchOption = request.getParameter(5);
        if (!matchOption.isEmpty() && !"CLOSEST".equalsIgnoreCase(matchOption)) {
            throw new FeatureStoreException("Match option " + matchOption + " is not supported");
        }
        String radiusText = request.getParameter(6).trim();
        double searchRadius = radiusText.isEmpty() ? 0 : parseDistance(radiusText);
        String distanceParameter = request.getParameter(7).trim();

        List<Field> fields = new ArrayList<>(attributeFields(target.getFields()));
        Map<String, String> joinNames = new LinkedHashMap<>();
        for (Field field : attributeFields(join.getFields())) {
            String name = uniqueName(field.getName(), fields);
            fields.add(field.renamed(name));
            joinNames.put(field.getName(), name);
        }
        String distanceField = null;
        if (!distanceParameter.isEmpty()) {
            distanceField = uniqueName(distanceParameter, fields);
            fields.add(new Field(distanceField, FieldType.DOUBLE, 0));
        }

        Dataset output = store.createDataset(outputPath(request, 2), DatasetKind.FEATURE_CLASS, fields);
        List<Row> joinRows = join.getRows();
        int matched = 0;
        for (Row row : target.getRows()) {
            Row nearest = null;
            double best = Double.MAX_VALUE;
            Geometry shape = row.getShape();
            if (shape != null) {
                for (Row candidate : joinRows) {
                    if (candidate.getShape() == null) {
                        continue;
                    }
                    double distance = shape.distance(candidate.getShape());
                    if (distance < best && (searchRadius <= 0 || distance <= searchRadius)) {
                        best = distance;
                        nearest = candidate;
                    }
                }
            }
            if (nearest == null && !keepAll) {
                continue;
            }
            Row copy = row.copy();
            for (Map.Entry<String, String> entry : joinNames.entrySet()) {
                copy.set(entry.getValue(), nearest == null ? null : nearest.get(entry.getKey()));
            }
            if (distanceField != null) {
                copy.set(distanceField, nearest == null ? null : best);
            }
            output.addRow(copy);
            if (nearest != null) {
                matched++;
            }
        }
        messages.accept("Joined " + matched + " of " + target.getRows().size() + " features");
    }

    // Statistics and dissolve

    private void statistics(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = store.resolve(request.getParameter(0));
        List<Statistic> statistics = parseStatistics(request.getParameter(2), source.getFields());
        if (statistics.isEmpty()) {
            throw new FeatureStoreException("Statistics fields parameter is required");
        }
        List<Field> caseFields = resolveFields(request.getParameter(3), source.getFields());

        List<Field> fields = new ArrayList<>();
        fields.add(new Field("FREQUENCY", FieldType.INTEGER, 0));
        addGroupAndStatisticFields(fields, caseFields, statistics);
        Dataset output = store.createDataset(outputPath(request, 1), DatasetKind.TABLE, fields);

        Map<List<Object>, List<Row>> groups = group(source.getRows(), caseFields);
        for (Map.Entry<List<Object>, List<Row>> group : groups.entrySet()) {
            Row row = summarize(group.getKey(), group.getValue(), caseFields, statistics);
            row.set("FREQUENCY", (long) group.getValue().size());
            output.addRow(row);
        }
        messages.accept("Summarized " + source.getRows().size() + " rows into " + groups.size() + " groups");
    }

    private void dissolve(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = requireFeatures(request.getParameter(0));
        List<Field> dissolveFields = resolveFields(request.getParameter(2), source.getFields());
        List<Statistic> statistics = parseStatistics(request.getParameter(3), source.getFields());

        List<Field> fields = new ArrayList<>();
        addGroupAndStatisticFields(fields, dissolveFields, statistics);
        Dataset output = store.createDataset(outputPath(request, 1), DatasetKind.FEATURE_CLASS, fields);

        Map<List<Object>, List<Row>> groups = group(source.getRows(), dissolveFields);
        for (Map.Entry<List<Object>, List<Row>> group : groups.entrySet()) {
            Row row = summarize(group.getKey(), group.getValue(), dissolveFields, statistics);
            row.set(Field.SHAPE, union(group.getValue()));
            output.addRow(row);
        }
        messages.accept("Dissolved " + source.getRows().size() + " features into " + groups.size());
    }

    private static class Statistic {
        final Field source;
        final AggregateFunction function;
        final Field output;

        Statistic(Field source, AggregateFunction function, Field output) {
            this.source = source;
            this.function = function;
            this.output = output;
        }
    }

    private List<Statistic> parseStatistics(String spec, FieldList fields) throws FeatureStoreException {
        List<Statistic> statistics = new ArrayList<>();
        List<Field> generated = new ArrayList<>();
        for (String part : spec.split(";")) {
            String[] tokens = part.trim().split("\\s+");
            if (tokens.length == 1 && tokens[0].isEmpty()) {
                continue;
            }
            if (tokens.length != 2) {
                throw new FeatureStoreException("Invalid statistic: " + part.trim());
            }
            Field field = fields.findField(tokens[0]);
            if (field == null) {
                throw new FeatureStoreException("Field " + tokens[0] + " does not exist");
            }
            AggregateFunction function = AggregateFunction.fromName(tokens[1]);
            if (function == null) {
                throw new FeatureStoreException("Unknown statistic type " + tokens[1]);
            }
            if (function.requiresNumericInput() && !field.getType().isNumeric()) {
                throw new FeatureStoreException(function + " requires a numeric field: " + field.getName());
            }
            String name = uniqueName(function.outputName(field.getName()), generated);
            Field output = function.outputField(field, name);
            generated.add(output);
            statistics.add(new Statistic(field, function, output));
        }
        return statistics;
    }

    private List<Field> resolveFields(String spec, FieldList fields) throws FeatureStoreException {
        List<Field> resolved = new ArrayList<>();
        for (String name : spec.split(";")) {
            if (name.trim().isEmpty()) {
                continue;
            }
            Field field = fields.findField(name.trim());
            if (field == null) {
                throw new FeatureStoreException("Field " + name.trim() + " does not exist");
            }
            resolved.add(field);
        }
        return resolved;
    }

    private static void addGroupAndStatisticFields(List<Field> fields, List<Field> groupFields,
                                                   List<Statistic> statistics) {
        for (Field field : groupFields) {
            fields.add(field.renamed(field.getName()));
        }
        for (Statistic statistic : statistics) {
            fields.add(statistic.output);
        }
    }

    /**
     * Group rows by the values of the given fields, groups ordered by those values.
     */
    private static Map<List<Object>, List<Row>> group(List<Row> rows, List<Field> groupFields) {
        Map<List<Object>, List<Row>> groups = new LinkedHashMap<>();
        for (Row row : rows) {
            List<Object> key = new ArrayList<>();
            for (Field field : groupFields) {
                key.add(row.get(field.getName()));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        List<List<Object>> keys = new ArrayList<>(groups.keySet());
        keys.sort((a, b) -> {
            for (int i = 0; i < a.size(); i++) {
                int comparison = Values.compare(a.get(i), b.get(i));
                if (comparison != 0) {
                    return comparison;
                }
            }
            return 0;
        });
        Map<List<Object>, List<Row>> sorted = new LinkedHashMap<>();
        for (List<Object> key : keys) {
            sorted.put(key, groups.get(key));
        }
        return sorted;
    }

    private static Row summarize(List<Object> key, List<Row> rows, List<Field> groupFields,
                                 List<Statistic> statistics) throws FeatureStoreException {
        Row row = new Row();
        for (int i = 0; i < groupFields.size(); i++) {
            row.set(groupFields.get(i).getName(), key.get(i));
        }
        for (Statistic statistic : statistics) {
            List<Object> values = new ArrayList<>();
            for (Row member : rows) {
                values.add(member.get(statistic.source.getName()));
            }
            row.set(statistic.output.getName(),
                    coerce(statistic.function.apply(values), statistic.output));
        }
        return row;
    }

    // Schema and calculation

    private void addField(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        Dataset dataset = store.resolve(request.getParameter(0)).getDataset();
        FieldType type = FieldType.fromName(request.getParameter(2));
        if (type == FieldType.OTHER || type == FieldType.GEOMETRY) {
            throw new FeatureStoreException("Unsupported field type " + request.getParameter(2));
        }
        int length = 0;
        if (!request.getParameter(3).trim().isEmpty()) {
            try {
                length = Integer.parseInt(request.getParameter(3).trim());
            } catch (NumberFormatException e) {
                throw new FeatureStoreException("Invalid field length " + request.getParameter(3), e);
            }
        }
        if (type == FieldType.STRING && length <= 0) {
            length = 255;
        }
        dataset.addField(new Field(request.getParameter(1).trim(), type, length));
        messages.accept("Added field " + request.getParameter(1) + " to " + dataset.getPath());
    }

    private void deleteField(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        Dataset dataset = store.resolve(request.getParameter(0)).getDataset();
        dataset.deleteField(request.getParameter(1).trim());
        messages.accept("Deleted field " + request.getParameter(1) + " from " + dataset.getPath());
    }

    /**
     * Expressions are a quoted literal, a field reference as [Field] or !Field!, a number,
     * or empty for null.
     */
    private void calculateField(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = store.resolve(request.getParameter(0));
        FieldList fields = source.getFields();
        Field target = fields.findField(request.getParameter(1).trim());
        if (target == null) {
            throw new FeatureStoreException("Field " + request.getParameter(1) + " does not exist");
        }
        String expression = request.getParameter(2).trim();

        String reference = null;
        Object constant = null;
        if (expression.length() >= 2 && expression.startsWith("\"") && expression.endsWith("\"")) {
            constant = expression.substring(1, expression.length() - 1);
        } else if (expression.length() >= 2 && ((expression.startsWith("[") && expression.endsWith("]"))
                || (expression.startsWith("!") && expression.endsWith("!")))) {
            Field referenced = fields.findField(expression.substring(1, expression.length() - 1));
            if (referenced == null) {
                throw new FeatureStoreException("Field " + expression + " does not exist");
            }
            reference = referenced.getName();
        } else if (!expression.isEmpty() && !"None".equalsIgnoreCase(expression)) {
            constant = parseNumber(expression);
        }

        List<Row> rows = source.getRows();
        for (Row row : rows) {
            Object value = reference != null ? row.get(reference) : constant;
            row.set(target.getName(), coerce(value, target));
        }
        messages.accept("Calculated " + target.getName() + " for " + rows.size() + " rows");
    }

    private void calculateGeometry(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = requireFeatures(request.getParameter(0));
        Field target = source.getFields().findField(request.getParameter(1).trim());
        if (target == null) {
            throw new FeatureStoreException("Field " + request.getParameter(1) + " does not exist");
        }
        if (!target.getType().isNumeric()) {
            throw new FeatureStoreException("Field " + target.getName() + " is not numeric");
        }
        if (!"AREA".equalsIgnoreCase(request.getParameter(2).trim())) {
            throw new FeatureStoreException("Geometry property " + request.getParameter(2) + " is not supported");
        }
        double divisor = areaDivisor(request.getParameter(3));

        List<Row> rows = source.getRows();
        for (Row row : rows) {
            Geometry shape = row.getShape();
            Double area = shape == null ? null : shape.getArea() / divisor;
            row.set(target.getName(), coerce(area, target));
        }
        messages.accept("Calculated area for " + rows.size() + " features");
    }

    private void delete(OperationRequest request, Consumer<String> messages) throws FeatureStoreException {
        DatasetPath path = DatasetPath.parse(request.getParameter(0));
        if (!store.deleteDataset(path)) {
            throw new DatasetNotFoundException(path.getFullPath());
        }
        messages.accept("Deleted " + path);
    }

    // Helpers

    private static double areaDivisor(String unit) throws FeatureStoreException {
        switch (unit.trim().toUpperCase(Locale.ROOT)) {
            case "":
            case "SQUARE_METERS":
                return 1.0;
            case "HECTARES":
                return 10_000.0;
            case "SQUARE_KILOMETERS":
                return 1_000_000.0;
            default:
                throw new FeatureStoreException("Unsupported area unit " + unit);
        }
    }

    /**
     * Convert a value to the storage type of a field. Doubles stored in integer fields are rounded.
     */
    static Object coerce(Object value, Field field) throws FeatureStoreException {
        if (value == null) {
            return null;
        }
        switch (field.getType()) {
            case INTEGER:
                if (value instanceof Double || value instanceof Float) {
                    return Math.round(((Number) value).doubleValue());
                }
                if (value instanceof Number) {
                    return ((Number) value).longValue();
                }
                return Math.round(parseNumber(value.toString()).doubleValue());
            case DOUBLE:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                return parseNumber(value.toString()).doubleValue();
            case STRING:
                String text = Values.toText(value);
                if (field.getLength() > 0 && text.length() > field.getLength()) {
                    throw new FeatureStoreException("Value '" + text + "' is too long for field "
                            + field.getName() + " (" + field.getLength() + ")");
                }
                return text;
            default:
                return value;
        }
    }

    private static Number parseNumber(String text) throws FeatureStoreException {
        String trimmed = text.trim();
        try {
            if (INTEGER_LITERAL.matcher(trimmed).matches()) {
                return Long.parseLong(trimmed);
            }
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new FeatureStoreException("Not a number: " + text, e);
        }
    }

    /**
     * Leading number of a linear distance such as "500 Meters".
     */
    private static double parseDistance(String text) throws FeatureStoreException {
        String[] tokens = text.trim().split("\\s+");
        try {
            return Double.parseDouble(tokens[0]);
        } catch (NumberFormatException e) {
            throw new FeatureStoreException("Invalid distance: " + text, e);
        }
    }

    private InMemoryFeatureStore.Source requireFeatures(String name) throws FeatureStoreException {
        InMemoryFeatureStore.Source source = store.resolve(name);
        if (source.getDataset().getKind() != DatasetKind.FEATURE_CLASS) {
            throw new FeatureStoreException(name + " is not a feature class");
        }
        return source;
    }

    private String requireLayer(String name) throws FeatureStoreException {
        MapSession.Entry entry = store.getSession().findLayer(name);
        if (entry == null) {
            throw new FeatureStoreException("Layer " + name + " is not loaded");
        }
        return entry.getName();
    }

    private static DatasetPath outputPath(OperationRequest request, int index) throws FeatureStoreException {
        String path = request.getParameter(index).trim();
        if (path.isEmpty()) {
            throw new FeatureStoreException("Output dataset is required");
        }
        return DatasetPath.parse(path);
    }

    /**
     * Non-system attribute fields, as copied into an output dataset.
     */
    private static List<Field> attributeFields(FieldList fields) {
        List<Field> attributes = new ArrayList<>();
        for (Field field : fields) {
            if (!field.isRequired() && field.getType() != FieldType.GEOMETRY) {
                attributes.add(field);
            }
        }
        return attributes;
    }

    private static String uniqueName(String name, List<Field> existing) {
        String candidate = name;
        int suffix = 1;
        while (contains(existing, candidate)) {
            candidate = name + "_" + suffix++;
        }
        return candidate;
    }

    private static boolean contains(List<Field> fields, String name) {
        for (Field field : fields) {
            if (field.getName().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private static Geometry union(List<Row> rows) {
        List<Geometry> shapes = new ArrayList<>();
        for (Row row : rows) {
            if (row.getShape() != null) {
                shapes.add(row.getShape());
            }
        }
        return shapes.isEmpty() ? null : UnaryUnionOp.union(shapes);
    }
}
