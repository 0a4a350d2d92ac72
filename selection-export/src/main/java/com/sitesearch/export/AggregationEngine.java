package com.sitesearch.export;

import com.sitesearch.store.*;
import com.sitesearch.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups a dataset and computes summary statistics per group through the store.
 *
 * Unknown group or statistic fields are dropped quietly. When there are groups but no
 * statistics, a FIRST of the first group field is added because the statistics operation
 * needs at least one statistic.
 */
public class AggregationEngine {
    private final SchemaValidator validator;
    private final OperationRunner runner;

    public AggregationEngine(SchemaValidator validator, OperationRunner runner) {
        this.validator = validator;
        this.runner = runner;
    }

    /**
     * Validate the specifications against the dataset fields.
     *
     * @param carryRadius add a FIRST of the Radius field so that the radius tag survives grouping
     */
    public AggregationPlan plan(String groupSpec, String statisticsSpec, FieldList fields, boolean carryRadius) {
        List<String> groups = new ArrayList<>();
        for (String group : ColumnSpec.splitList(groupSpec)) {
            Field field = validator.resolveField(fields, group);
            if (field != null) {
                groups.add(field.getName());
            } else {
                LoggingUtil.debug("Group field " + group + " not found, ignored");
            }
        }

        List<StatisticColumn> statistics = new ArrayList<>();
        for (String entry : ColumnSpec.splitList(statisticsSpec)) {
            StatisticColumn statistic = StatisticColumn.parse(entry);
            if (statistic == null) {
                LoggingUtil.debug("Statistic '" + entry + "' is not valid, ignored");
                continue;
            }
            Field field = validator.resolveField(fields, statistic.getField());
            if (field == null) {
                LoggingUtil.debug("Statistic field " + statistic.getField() + " not found, ignored");
            } else {
                statistics.add(new StatisticColumn(field.getName(), statistic.getFunction()));
            }
        }

        boolean placeholder = false;
        if (!groups.isEmpty() && statistics.isEmpty()) {
            statistics.add(new StatisticColumn(groups.get(0), AggregateFunction.FIRST));
            placeholder = true;
        }

        if (carryRadius && !groups.isEmpty()
                && !StatisticColumn.mentions(statistics, DerivedFieldCalculator.RADIUS_FIELD)
                && !ColumnSpec.containsIgnoreCase(groups, DerivedFieldCalculator.RADIUS_FIELD)
                && validator.fieldExists(fields, DerivedFieldCalculator.RADIUS_FIELD)) {
            statistics.add(new StatisticColumn(DerivedFieldCalculator.RADIUS_FIELD, AggregateFunction.FIRST));
        }

        AggregationPlan plan = new AggregationPlan(groups, statistics, placeholder);
        LoggingUtil.debug("Aggregation plan: " + plan);
        return plan;
    }

    /**
     * Summarize into a table: OBJECTID, FREQUENCY, group fields, then one field per statistic.
     */
    public void summarize(String input, String outputTable, AggregationPlan plan) throws OperationFailedException {
        runner.run(EngineOperation.STATISTICS, input, outputTable, plan.getStatisticsSpec(), plan.getGroupSpec());
    }

    /**
     * Dissolve into a feature class: OBJECTID, Shape, group fields, then one field per statistic.
     */
    public void dissolve(String input, String outputFeatureClass, AggregationPlan plan) throws OperationFailedException {
        runner.run(EngineOperation.DISSOLVE, input, outputFeatureClass, plan.getGroupSpec(), plan.getStatisticsSpec());
    }
}
