package com.sitesearch.store;

public class DatasetNotFoundException extends FeatureStoreException {
    private final String dataset;

    public DatasetNotFoundException(String dataset) {
        super("Dataset " + dataset + " does not exist");
        this.dataset = dataset;
    }

    public String getDataset() {
        return dataset;
    }
}
