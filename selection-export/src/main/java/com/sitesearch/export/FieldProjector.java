package com.sitesearch.export;

import com.sitesearch.store.FieldList;
import com.sitesearch.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops unknown field names from a column specification, keeping literals untouched.
 */
public class FieldProjector {
    private final SchemaValidator validator;

    public FieldProjector(SchemaValidator validator) {
        this.validator = validator;
    }

    public Projection project(String columnSpec, FieldList fields, String datasetName) {
        List<String> tokens = new ArrayList<>();
        List<String> missing = new ArrayList<>();

        for (String token : ColumnSpec.splitColumns(columnSpec)) {
            if (ColumnSpec.isLiteral(token) || validator.fieldExists(fields, token)) {
                tokens.add(token);
            } else {
                missing.add(token);
            }
        }

        if (!missing.isEmpty()) {
            LoggingUtil.warn("The following field(s) could not be found in " + datasetName + ": "
                    + String.join(", ", missing));
        }
        return new Projection(tokens, missing);
    }
}
