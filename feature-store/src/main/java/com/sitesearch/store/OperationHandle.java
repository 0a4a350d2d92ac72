package com.sitesearch.store;

import java.util.List;

/**
 * Handle on an operation dispatched to a feature store. Status is polled by the caller.
 */
public interface OperationHandle {
    OperationRequest getRequest();

    OperationStatus getStatus();

    /** Error text once the operation failed, otherwise null. */
    String getErrorMessage();

    /** Diagnostic messages recorded so far. */
    List<String> getMessages();

    /** Ask the store to stop the operation; it ends CANCELLED if it has not finished. */
    void cancel();
}
