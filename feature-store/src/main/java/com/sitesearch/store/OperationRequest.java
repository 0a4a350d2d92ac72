package com.sitesearch.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An engine operation plus its positional parameters.
 */
public class OperationRequest {
    private final EngineOperation operation;
    private final List<String> parameters;

    public OperationRequest(EngineOperation operation, List<String> parameters) {
        this.operation = operation;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static OperationRequest of(EngineOperation operation, String... parameters) {
        return new OperationRequest(operation, Arrays.asList(parameters));
    }

    public EngineOperation getOperation() {
        return operation;
    }

    public List<String> getParameters() {
        return parameters;
    }

    /**
     * Parameter at the given position; missing or null parameters read as an empty string.
     */
    public String getParameter(int index) {
        if (index < 0 || index >= parameters.size() || parameters.get(index) == null) {
            return "";
        }
        return parameters.get(index);
    }

    @Override
    public String toString() {
        return operation + " " + parameters;
    }
}
