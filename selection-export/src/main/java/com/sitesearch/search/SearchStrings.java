package com.sitesearch.search;

import com.sitesearch.export.ColumnSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the names used by a search from the search reference and site name.
 *
 * <ul>
 *   <li>reference: the search reference with "/" replaced by the replacement character</li>
 *   <li>short reference: the reference reduced to digits, spaces and replacement characters</li>
 *   <li>sub-reference: the part of the short reference after its last replacement character</li>
 * </ul>
 */
public final class SearchStrings {
    private static final Pattern PLACEHOLDER = Pattern.compile("(?i)%(ref|shortref|subref|sitename|radius)%");
    private static final String ILLEGAL_CHARACTERS = "\\/:*?\"<>|";

    private SearchStrings() {
    }

    public static String reference(String searchRef, String repChar) {
        return searchRef.trim().replace("/", repChar);
    }

    public static String keepNumbersAndSpaces(String text, String repChar) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isDigit(c) || c == ' ' || repChar.indexOf(c) >= 0) {
                result.append(c);
            }
        }
        String kept = result.toString().trim();
        if (repChar.isEmpty()) {
            return kept;
        }
        while (kept.startsWith(repChar)) {
            kept = kept.substring(repChar.length());
        }
        while (kept.endsWith(repChar)) {
            kept = kept.substring(0, kept.length() - repChar.length());
        }
        return kept.trim();
    }

    public static String getSubref(String shortRef, String repChar) {
        if (repChar.isEmpty()) {
            return shortRef;
        }
        int index = shortRef.lastIndexOf(repChar);
        return index < 0 ? shortRef : shortRef.substring(index + repChar.length());
    }

    /**
     * Replace characters that cannot appear in a file or dataset name.
     */
    public static String stripIllegals(String text, String repChar) {
        if (text == null) {
            return null;
        }
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (ILLEGAL_CHARACTERS.indexOf(c) >= 0 || Character.isISOControl(c)) {
                result.append(repChar);
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Substitute %ref%, %shortref%, %subref%, %sitename% and %radius% (any case).
     */
    public static String replaceSearchStrings(String text, String reference, String siteName, String shortRef,
                                              String subref, String radius) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuffer result = new StringBuffer();
        while (matcher.find()) {
            String value;
            switch (matcher.group(1).toLowerCase()) {
                case "ref":
                    value = reference;
                    break;
                case "shortref":
                    value = shortRef;
                    break;
                case "subref":
                    value = subref;
                    break;
                case "sitename":
                    value = siteName;
                    break;
                default:
                    value = radius;
                    break;
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Add a FIRST statistic for every output column that is neither a group column nor
     * already summarized, so that it survives the grouping. Without group columns the
     * statistics are returned unchanged.
     */
    public static String alignStatisticsColumns(String columns, String statisticsColumns, String groupColumns) {
        List<String> groups = ColumnSpec.splitList(groupColumns);
        if (groups.isEmpty()) {
            return statisticsColumns;
        }

        List<String> statistics = new ArrayList<>(ColumnSpec.splitList(statisticsColumns));
        List<String> summarized = new ArrayList<>();
        for (String statistic : statistics) {
            summarized.add(statistic.trim().split("\\s+")[0]);
        }

        for (String column : ColumnSpec.splitColumns(columns)) {
            if (ColumnSpec.isLiteral(column) || ColumnSpec.containsIgnoreCase(groups, column)
                    || ColumnSpec.containsIgnoreCase(summarized, column)) {
                continue;
            }
            statistics.add(column + " FIRST");
            summarized.add(column);
        }
        return String.join(ColumnSpec.LIST_SEPARATOR, statistics);
    }
}
