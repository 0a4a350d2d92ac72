package com.sitesearch.export;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splitting of column, group and statistic specifications.
 *
 * Output columns are separated by commas; a column starting with a double quote is a
 * literal written as is. Group and statistic lists are separated by semicolons.
 */
public final class ColumnSpec {
    public static final String COLUMN_SEPARATOR = ",";
    public static final String LIST_SEPARATOR = ";";

    private ColumnSpec() {
    }

    /**
     * Trimmed, non-empty tokens in their original order.
     */
    public static List<String> split(String spec, String separator) {
        List<String> tokens = new ArrayList<>();
        if (spec == null) {
            return tokens;
        }
        for (String token : spec.split(Pattern.quote(separator), -1)) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }

    public static List<String> splitColumns(String spec) {
        return split(spec, COLUMN_SEPARATOR);
    }

    public static List<String> splitList(String spec) {
        return split(spec, LIST_SEPARATOR);
    }

    public static boolean isLiteral(String token) {
        return token.startsWith("\"");
    }

    public static boolean containsIgnoreCase(List<String> names, String name) {
        for (String candidate : names) {
            if (candidate.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}
