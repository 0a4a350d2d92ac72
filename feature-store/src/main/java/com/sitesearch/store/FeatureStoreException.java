package com.sitesearch.store;

/**
 * Base class for failures reported by a feature store.
 */
public class FeatureStoreException extends Exception {
    public FeatureStoreException(String message) {
        super(message);
    }

    public FeatureStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
