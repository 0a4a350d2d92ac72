package com.sitesearch.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine operation ended in FAILED or CANCELLED. Carries the operation's error text
 * and its diagnostic messages so the caller can log them verbatim.
 */
public class OperationFailedException extends FeatureStoreException {
    private final OperationRequest request;
    private final OperationStatus status;
    private final List<String> diagnostics;

    public OperationFailedException(OperationRequest request, OperationStatus status,
                                    String errorText, List<String> diagnostics) {
        super(buildMessage(request, status, errorText));
        this.request = request;
        this.status = status;
        this.diagnostics = diagnostics == null ? Collections.emptyList() : new ArrayList<>(diagnostics);
    }

    private static String buildMessage(OperationRequest request, OperationStatus status, String errorText) {
        String operation = request == null ? "Operation" : request.getOperation().name();
        if (errorText == null || errorText.isEmpty()) {
            return operation + " ended with status " + status;
        }
        return operation + " ended with status " + status + ": " + errorText;
    }

    public OperationRequest getRequest() {
        return request;
    }

    public OperationStatus getStatus() {
        return status;
    }

    public List<String> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Error text followed by the diagnostic messages, one per line.
     */
    public String getFullMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        for (String line : diagnostics) {
            sb.append(System.lineSeparator()).append(line);
        }
        return sb.toString();
    }
}
