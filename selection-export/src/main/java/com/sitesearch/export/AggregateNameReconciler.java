package com.sitesearch.export;

import com.sitesearch.store.*;
import com.sitesearch.util.LoggingUtil;

import java.util.List;

/**
 * Gives statistic outputs back the names of the fields they were computed from
 * (SUM_Area becomes Area again).
 *
 * Generated fields are located by position, not by name: the statistics operation always
 * writes {@value #LEADING_SYSTEM_FIELD_COUNT} system fields first, then the group fields,
 * then one field per statistic in the order requested. Changing the leading count breaks
 * every existing output layout.
 */
public class AggregateNameReconciler {

    /** OBJECTID plus FREQUENCY (tables) or Shape (feature classes). */
    public static final int LEADING_SYSTEM_FIELD_COUNT = 2;

    private final FeatureStore store;
    private final OperationRunner runner;

    public AggregateNameReconciler(FeatureStore store, OperationRunner runner) {
        this.store = store;
        this.runner = runner;
    }

    /**
     * Position of the field generated for the statistic at {@code statisticIndex}.
     */
    public static int expectedIndex(int groupCount, int statisticIndex) {
        return LEADING_SYSTEM_FIELD_COUNT + groupCount + statisticIndex;
    }

    /**
     * Rename generated statistic fields of {@code output} after their source fields.
     * A rename is skipped with a warning when it cannot be done safely.
     *
     * @return number of fields renamed
     */
    public int reconcile(List<String> groups, List<StatisticColumn> statistics, String output,
                         FieldList sourceFields) throws FeatureStoreException {
        // Positions refer to the layout before any rename
        FieldList generated = store.getFields(output);
        int renamed = 0;

        for (int i = 0; i < statistics.size(); i++) {
            StatisticColumn statistic = statistics.get(i);
            int index = expectedIndex(groups.size(), i);
            if (index >= generated.size()) {
                LoggingUtil.warn("No generated field at position " + index + " for " + statistic + " in " + output);
                continue;
            }
            Field generatedField = generated.get(index);

            Field source = sourceFields.findField(statistic.getField());
            if (source == null) {
                LoggingUtil.warn("Source field " + statistic.getField() + " not found; keeping "
                        + generatedField.getName());
                continue;
            }

            if (store.getFields(output).findField(source.getName()) != null) {
                if (ColumnSpec.containsIgnoreCase(groups, source.getName())) {
                    LoggingUtil.debug("Field " + source.getName() + " is a group field; keeping "
                            + generatedField.getName());
                } else {
                    LoggingUtil.warn("Field " + source.getName() + " already exists in " + output + "; keeping "
                            + generatedField.getName());
                }
                continue;
            }

            if (!isCompatible(generatedField.getType(), source.getType())) {
                LoggingUtil.warn("Cannot rename " + generatedField.getName() + " (" + generatedField.getType()
                        + ") to " + source.getName() + " (" + source.getType() + ")");
                continue;
            }

            runner.run(EngineOperation.ADD_FIELD, output, source.getName(), source.getType().name(),
                    String.valueOf(source.getLength()));
            runner.run(EngineOperation.CALCULATE_FIELD, output, source.getName(), "[" + generatedField.getName() + "]");
            runner.run(EngineOperation.DELETE_FIELD, output, generatedField.getName());
            LoggingUtil.debug("Renamed " + generatedField.getName() + " to " + source.getName());
            renamed++;
        }
        return renamed;
    }

    /**
     * Same type, both numeric, or a text target.
     */
    static boolean isCompatible(FieldType generated, FieldType target) {
        return generated == target
                || (generated.isNumeric() && target.isNumeric())
                || target == FieldType.STRING;
    }
}
