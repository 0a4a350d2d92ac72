package com.sitesearch.export;

import com.sitesearch.store.*;
import com.sitesearch.util.LoggingUtil;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports the selected features of a map layer, either as a delimited text table or as a
 * new feature class.
 *
 * Missing or unusable fields only narrow the output. A failed store operation aborts the
 * export and is reported through the log (and the notifier, when the request asks for it).
 * Temporary datasets are removed whatever the outcome.
 */
public class SelectionExporter {
    private final FeatureStore store;
    private final MapSession session;
    private final OperationRunner runner;
    private final UserNotifier notifier;

    private final SchemaValidator validator;
    private final DerivedFieldCalculator calculator;
    private final AggregationEngine aggregation;
    private final AggregateNameReconciler reconciler;
    private final CsvSerializer serializer;

    public SelectionExporter(FeatureStore store, MapSession session, OperationRunner runner) {
        this(store, session, runner, UserNotifier.NONE);
    }

    public SelectionExporter(FeatureStore store, MapSession session, OperationRunner runner, UserNotifier notifier) {
        this.store = store;
        this.session = session;
        this.runner = runner;
        this.notifier = notifier;
        this.validator = new SchemaValidator(store);
        this.calculator = new DerivedFieldCalculator(store, validator, runner);
        this.aggregation = new AggregationEngine(validator, runner);
        this.reconciler = new AggregateNameReconciler(store, runner);
        this.serializer = new CsvSerializer(store, validator, new FieldProjector(validator), new TableSorter(validator));
    }

    public SchemaValidator getValidator() {
        return validator;
    }

    public CsvSerializer getSerializer() {
        return serializer;
    }

    public TemporaryResources newTemporaryResources() {
        return new TemporaryResources(session, validator, runner);
    }

    /**
     * Export the layer selection to a text file.
     *
     * @return data rows written, 0 when there was nothing to write, -1 on failure
     */
    public int exportSelectionToCsv(ExportRequest request) {
        final String function = "exportSelectionToCsv";
        String layer = request.getLayerName();

        if (!session.isLayerLoaded(layer)) {
            reportError(function, "Layer " + layer + " is not loaded", request);
            return -1;
        }
        if (request.isCheckForSelection() && session.getSelectionCount(layer) == 0) {
            reportError(function, "There are no features selected in " + layer, request);
            return -1;
        }
        if (!request.isOverwrite() && !Files.exists(Paths.get(request.getOutputPath()))) {
            reportError(function, "Cannot append to " + request.getOutputPath() + ": the file does not exist", request);
            return -1;
        }
        AreaUnit unit = resolveAreaUnit(function, request);
        if (request.isIncludeArea() && unit == null) {
            return -1;
        }

        String tempFeatureClass = request.getTempFeatureClass();
        String tempTable = request.getTempTable();
        boolean areaAdded = false;

        try (TemporaryResources temporaries = newTemporaryResources().track(tempFeatureClass, tempTable)) {
            try {
                if (request.isIncludeArea()) {
                    areaAdded = calculator.addArea(layer, unit);
                }

                if (request.isIncludeDistance()) {
                    calculator.addDistance(layer, request.getTargetLayer(), tempFeatureClass);
                } else {
                    runner.run(EngineOperation.COPY_FEATURES, layer, tempFeatureClass);
                }
                DatasetPath tempPath = DatasetPath.parse(tempFeatureClass);
                session.addLayer(tempPath.getBaseName(), tempPath);

                boolean radiusAdded = calculator.addRadius(tempFeatureClass, request.getRadius());

                FieldList fields = store.getFields(tempFeatureClass);
                AggregationPlan plan = aggregation.plan(request.getGroupColumns(), request.getStatisticsColumns(),
                        fields, radiusAdded);

                String exportSource = tempFeatureClass;
                if (plan.isActive()) {
                    aggregation.summarize(tempFeatureClass, tempTable, plan);
                    DatasetPath tablePath = DatasetPath.parse(tempTable);
                    session.addTable(tablePath.getBaseName(), tablePath);
                    if (request.isRenameColumns()) {
                        reconciler.reconcile(plan.getGroupColumns(), plan.getStatistics(), tempTable, fields);
                    }
                    exportSource = tempTable;
                }

                int rowCount = serializer.copyToCsv(exportSource, request.getOutputPath(), request.getColumns(),
                        request.getOrderColumns(), !request.isOverwrite(), !request.isIncludeHeaders());
                if (rowCount < 0) {
                    reportError(function, "Could not write " + request.getOutputPath(), request);
                } else {
                    LoggingUtil.info(rowCount + " record(s) exported from " + layer + " to " + request.getOutputPath());
                }
                return rowCount;
            } catch (OperationFailedException e) {
                reportError(function, e.getFullMessage(), request);
                return -1;
            } catch (FeatureStoreException e) {
                reportError(function, e.getMessage(), request);
                return -1;
            } finally {
                if (areaAdded) {
                    stripArea(layer);
                }
            }
        }
    }

    /**
     * Export the layer selection to a new feature class, dissolving and joining distances
     * as requested. Non-required fields of the result that are not named in the output
     * columns are deleted; with no output columns every field is kept.
     *
     * @return true if the output was written
     */
    public boolean exportSelectionToShapefile(ExportRequest request) {
        final String function = "exportSelectionToShapefile";
        String layer = request.getLayerName();
        String output = request.getOutputPath();

        if (!session.isLayerLoaded(layer)) {
            reportError(function, "Layer " + layer + " is not loaded", request);
            return false;
        }
        if (request.isCheckForSelection() && session.getSelectionCount(layer) == 0) {
            reportError(function, "There are no features selected in " + layer, request);
            return false;
        }
        if (!request.isOverwrite() && validator.exists(output)) {
            reportError(function, "Output " + output + " already exists", request);
            return false;
        }
        AreaUnit unit = resolveAreaUnit(function, request);
        if (request.isIncludeArea() && unit == null) {
            return false;
        }

        String tempFeatureClass = request.getTempFeatureClass();
        boolean areaAdded = false;

        try (TemporaryResources temporaries = newTemporaryResources().track(tempFeatureClass)) {
            try {
                if (request.isIncludeArea()) {
                    areaAdded = calculator.addArea(layer, unit);
                }

                FieldList inputFields = store.getFields(layer);
                AggregationPlan plan = aggregation.plan(request.getGroupColumns(), request.getStatisticsColumns(),
                        inputFields, false);

                String current = layer;
                if (plan.isActive()) {
                    String dissolveOutput = request.isIncludeDistance() ? tempFeatureClass : output;
                    aggregation.dissolve(layer, dissolveOutput, plan);
                    if (request.isRenameColumns()) {
                        reconciler.reconcile(plan.getGroupColumns(), plan.getStatistics(), dissolveOutput, inputFields);
                    }
                    current = dissolveOutput;
                }

                if (request.isIncludeDistance()) {
                    calculator.addDistance(current, request.getTargetLayer(), output);
                } else if (!plan.isActive()) {
                    runner.run(EngineOperation.COPY_FEATURES, layer, output);
                }

                calculator.addRadius(output, request.getRadius());
                keepOutputColumns(output, request.getColumns());

                LoggingUtil.info("Features exported from " + layer + " to " + output);
                return true;
            } catch (OperationFailedException e) {
                reportError(function, e.getFullMessage(), request);
                return false;
            } catch (FeatureStoreException e) {
                reportError(function, e.getMessage(), request);
                return false;
            } finally {
                if (areaAdded) {
                    stripArea(layer);
                }
            }
        }
    }

    private void keepOutputColumns(String output, String columns) throws FeatureStoreException {
        List<String> keep = new ArrayList<>();
        for (String token : ColumnSpec.splitColumns(columns)) {
            if (!ColumnSpec.isLiteral(token)) {
                keep.add(token);
            }
        }
        if (keep.isEmpty()) {
            return;
        }

        List<String> drop = new ArrayList<>();
        for (Field field : store.getFields(output)) {
            if (!field.isRequired() && field.getType() != FieldType.GEOMETRY
                    && !ColumnSpec.containsIgnoreCase(keep, field.getName())) {
                drop.add(field.getName());
            }
        }
        for (String name : drop) {
            runner.run(EngineOperation.DELETE_FIELD, output, name);
        }
        if (!drop.isEmpty()) {
            LoggingUtil.debug("Deleted fields " + String.join(", ", drop) + " from " + output);
        }
    }

    private AreaUnit resolveAreaUnit(String function, ExportRequest request) {
        if (!request.isIncludeArea()) {
            return null;
        }
        AreaUnit unit = AreaUnit.fromCode(request.getAreaUnit());
        if (unit == null) {
            reportError(function, "Unknown area unit " + request.getAreaUnit(), request);
        }
        return unit;
    }

    private void stripArea(String layer) {
        try {
            calculator.removeArea(layer);
        } catch (FeatureStoreException e) {
            LoggingUtil.warn("Could not remove the Area field from " + layer + ": " + e.getMessage());
        }
    }

    private void reportError(String function, String message, ExportRequest request) {
        String text = "Function " + function + " returned the following error: " + message;
        LoggingUtil.error(text);
        if (request.isNotifyUser()) {
            notifier.notify("Data Searches", text);
        }
    }
}
