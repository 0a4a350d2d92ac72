package com.sitesearch.store;

public enum DatasetKind {
    FEATURE_CLASS,
    TABLE
}
