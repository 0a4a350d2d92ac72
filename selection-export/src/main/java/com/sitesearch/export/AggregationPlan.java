package com.sitesearch.export;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Validated group fields and statistics for one aggregation.
 */
public class AggregationPlan {
    private final List<String> groupColumns;
    private final List<StatisticColumn> statistics;
    private final boolean placeholderInjected;

    public AggregationPlan(List<String> groupColumns, List<StatisticColumn> statistics, boolean placeholderInjected) {
        this.groupColumns = Collections.unmodifiableList(new ArrayList<>(groupColumns));
        this.statistics = Collections.unmodifiableList(new ArrayList<>(statistics));
        this.placeholderInjected = placeholderInjected;
    }

    public List<String> getGroupColumns() {
        return groupColumns;
    }

    public List<StatisticColumn> getStatistics() {
        return statistics;
    }

    public boolean isPlaceholderInjected() {
        return placeholderInjected;
    }

    /** Whether there is anything to group or summarize. */
    public boolean isActive() {
        return !groupColumns.isEmpty() || !statistics.isEmpty();
    }

    public String getGroupSpec() {
        return String.join(ColumnSpec.LIST_SEPARATOR, groupColumns);
    }

    public String getStatisticsSpec() {
        return StatisticColumn.join(statistics);
    }

    @Override
    public String toString() {
        return "group [" + getGroupSpec() + "] statistics [" + getStatisticsSpec() + "]";
    }
}
