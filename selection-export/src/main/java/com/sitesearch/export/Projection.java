package com.sitesearch.export;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of cleaning a column specification against a field list.
 */
public class Projection {
    private final List<String> tokens;
    private final List<String> missingNames;

    public Projection(List<String> tokens, List<String> missingNames) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        this.missingNames = Collections.unmodifiableList(new ArrayList<>(missingNames));
    }

    /** Surviving columns and literals, in the order requested. */
    public List<String> getTokens() {
        return tokens;
    }

    /** Requested field names that do not exist. */
    public List<String> getMissingNames() {
        return missingNames;
    }

    /** The surviving tokens joined by commas; also used as the header line. */
    public String getCleanedSpec() {
        return String.join(ColumnSpec.COLUMN_SEPARATOR, tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public String toString() {
        return getCleanedSpec();
    }
}
