package com.sitesearch.store;

import com.sitesearch.util.LoggingUtil;

/**
 * Runs store operations synchronously: dispatches the request, then polls the handle on a
 * fixed interval until it reaches a terminal status. There is no timeout.
 */
public class OperationRunner {
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 1000L;

    private final FeatureStore store;
    private final long pollIntervalMillis;

    public OperationRunner(FeatureStore store) {
        this(store, DEFAULT_POLL_INTERVAL_MILLIS);
    }

    public OperationRunner(FeatureStore store, long pollIntervalMillis) {
        if (pollIntervalMillis <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollIntervalMillis);
        }
        this.store = store;
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public OperationHandle run(EngineOperation operation, String... parameters) throws OperationFailedException {
        return run(OperationRequest.of(operation, parameters));
    }

    /**
     * Execute and wait.
     *
     * @throws OperationFailedException if the operation ends FAILED or CANCELLED
     */
    public OperationHandle run(OperationRequest request) throws OperationFailedException {
        LoggingUtil.debug("Running " + request);
        OperationHandle handle = store.execute(request);
        OperationStatus status = waitFor(handle);
        for (String message : handle.getMessages()) {
            LoggingUtil.debug("  " + message);
        }
        if (status != OperationStatus.SUCCEEDED) {
            throw new OperationFailedException(request, status, handle.getErrorMessage(), handle.getMessages());
        }
        return handle;
    }

    /**
     * Block until the handle is terminal. An interrupt cancels the operation.
     */
    public OperationStatus waitFor(OperationHandle handle) throws OperationFailedException {
        OperationStatus status = handle.getStatus();
        while (!status.isTerminal()) {
            try {
                Thread.sleep(pollIntervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handle.cancel();
                throw new OperationFailedException(handle.getRequest(), OperationStatus.CANCELLED,
                        "Interrupted while waiting for the operation", handle.getMessages());
            }
            status = handle.getStatus();
        }
        return status;
    }
}
