package com.sitesearch.store;

/**
 * Capabilities the export pipeline needs from a spatial feature store.
 *
 * A dataset argument is either the name of a layer or table loaded in the map session
 * (in which case the layer's selection applies) or a full dataset path.
 */
public interface FeatureStore {

    /**
     * Whether a dataset of the given kind (any kind when null) exists in a workspace.
     *
     * @throws FeatureStoreException if the workspace cannot be opened
     */
    boolean nameExists(String workspace, DatasetKind kind, String name) throws FeatureStoreException;

    FieldList getFields(String dataset) throws DatasetNotFoundException;

    DatasetKind getKind(String dataset) throws DatasetNotFoundException;

    /**
     * Geometry family of the first feature, OTHER for tables and empty feature classes.
     */
    GeometryKind sampleGeometryKind(String dataset) throws DatasetNotFoundException;

    /**
     * Open a cursor over the dataset's rows (the selected rows for a layer with a selection).
     */
    RowCursor search(String dataset) throws DatasetNotFoundException;

    /**
     * Dispatch an operation. Never blocks; completion is observed through the handle.
     */
    OperationHandle execute(OperationRequest request);
}
