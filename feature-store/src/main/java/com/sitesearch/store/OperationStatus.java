package com.sitesearch.store;

public enum OperationStatus {
    NEW,
    EXECUTING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
