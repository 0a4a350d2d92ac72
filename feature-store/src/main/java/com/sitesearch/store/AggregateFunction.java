package com.sitesearch.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Summary statistics supported by the STATISTICS and DISSOLVE operations.
 * The generated output field is named FUNCTION_field.
 */
public enum AggregateFunction {
    SUM,
    MEAN,
    MIN,
    MAX,
    RANGE,
    STD,
    COUNT,
    FIRST,
    LAST;

    /**
     * @return the function, or null when the name is not a statistic keyword
     */
    public static AggregateFunction fromName(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean requiresNumericInput() {
        return this == SUM || this == MEAN || this == RANGE || this == STD;
    }

    public String outputName(String sourceField) {
        return name() + "_" + sourceField;
    }

    /**
     * Definition of the generated field for a statistic over the source field.
     */
    public Field outputField(Field source, String outputName) {
        switch (this) {
            case COUNT:
                return new Field(outputName, FieldType.INTEGER, 0);
            case FIRST:
            case LAST:
                return new Field(outputName, source.getType(), source.getLength());
            case MIN:
            case MAX:
                if (source.getType().isNumeric()) {
                    return new Field(outputName, FieldType.DOUBLE, 0);
                }
                return new Field(outputName, source.getType(), source.getLength());
            default:
                return new Field(outputName, FieldType.DOUBLE, 0);
        }
    }

    /**
     * Compute the statistic over one group's values, in row order. Nulls are ignored except
     * by FIRST and LAST.
     */
    public Object apply(List<Object> values) {
        switch (this) {
            case FIRST:
                return values.isEmpty() ? null : values.get(0);
            case LAST:
                return values.isEmpty() ? null : values.get(values.size() - 1);
            case COUNT:
                long count = 0;
                for (Object value : values) {
                    if (value != null) {
                        count++;
                    }
                }
                return count;
            case MIN:
            case MAX:
                return extreme(values, this == MAX);
            default:
                return numeric(values);
        }
    }

    private Object extreme(List<Object> values, boolean max) {
        Object best = null;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (best == null || (max ? Values.compare(value, best) > 0 : Values.compare(value, best) < 0)) {
                best = value;
            }
        }
        if (best instanceof Number) {
            return ((Number) best).doubleValue();
        }
        return best;
    }

    private Double numeric(List<Object> values) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Number) {
                numbers.add(((Number) value).doubleValue());
            }
        }
        if (numbers.isEmpty()) {
            return null;
        }
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double d : numbers) {
            sum += d;
            min = Math.min(min, d);
            max = Math.max(max, d);
        }
        switch (this) {
            case SUM:
                return sum;
            case MEAN:
                return sum / numbers.size();
            case RANGE:
                return max - min;
            case STD:
                // population standard deviation
                double mean = sum / numbers.size();
                double squares = 0;
                for (double d : numbers) {
                    squares += (d - mean) * (d - mean);
                }
                return Math.sqrt(squares / numbers.size());
            default:
                throw new IllegalStateException("Not a numeric statistic: " + this);
        }
    }
}
