package com.sitesearch.export;

import com.sitesearch.store.AggregateFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * One "field FUNCTION" entry of a statistics specification.
 */
public class StatisticColumn {
    private final String field;
    private final AggregateFunction function;

    public StatisticColumn(String field, AggregateFunction function) {
        this.field = field;
        this.function = function;
    }

    public String getField() {
        return field;
    }

    public AggregateFunction getFunction() {
        return function;
    }

    /**
     * Parse a single entry; null when it is not a field followed by a known function.
     */
    public static StatisticColumn parse(String entry) {
        String[] parts = entry.trim().split("\\s+");
        if (parts.length != 2) {
            return null;
        }
        AggregateFunction function = AggregateFunction.fromName(parts[1]);
        return function == null ? null : new StatisticColumn(parts[0], function);
    }

    public static String join(List<StatisticColumn> statistics) {
        List<String> entries = new ArrayList<>();
        for (StatisticColumn statistic : statistics) {
            entries.add(statistic.toString());
        }
        return String.join(ColumnSpec.LIST_SEPARATOR, entries);
    }

    public static boolean mentions(List<StatisticColumn> statistics, String field) {
        for (StatisticColumn statistic : statistics) {
            if (statistic.field.equalsIgnoreCase(field)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return field + " " + function.name();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof StatisticColumn)) {
            return false;
        }
        StatisticColumn that = (StatisticColumn) other;
        return field.equalsIgnoreCase(that.field) && function == that.function;
    }

    @Override
    public int hashCode() {
        return field.toLowerCase().hashCode() * 31 + function.hashCode();
    }
}
