package com.sitesearch.export;

import com.sitesearch.store.*;
import com.sitesearch.util.LoggingUtil;

import java.nio.file.Files;

/**
 * Existence checks for fields, feature classes and tables.
 * None of these checks fail: anything that cannot be read counts as missing.
 */
public class SchemaValidator {
    private final FeatureStore store;

    public SchemaValidator(FeatureStore store) {
        this.store = store;
    }

    /**
     * Field lookup by name first, then by alias.
     */
    public boolean fieldExists(FieldList fields, String name) {
        return resolveField(fields, name) != null;
    }

    public Field resolveField(FieldList fields, String name) {
        if (fields == null || name == null || name.trim().isEmpty()) {
            return null;
        }
        Field field = fields.findField(name.trim());
        return field != null ? field : fields.findFieldByAlias(name.trim());
    }

    public boolean fieldExists(String dataset, String name) {
        try {
            return fieldExists(store.getFields(dataset), name);
        } catch (DatasetNotFoundException e) {
            LoggingUtil.debug("Cannot read fields of " + dataset + ": " + e.getMessage());
            return false;
        }
    }

    public boolean featureClassExists(String path) {
        return datasetExists(path, DatasetKind.FEATURE_CLASS);
    }

    public boolean tableExists(String path) {
        return datasetExists(path, DatasetKind.TABLE);
    }

    /**
     * Whether a dataset of any kind exists at the path.
     */
    public boolean exists(String path) {
        return datasetExists(path, null);
    }

    /**
     * Whether the store can open the name, which may also be a layer or table loaded in the session.
     */
    public boolean inputExists(String name) {
        if (exists(name)) {
            return true;
        }
        try {
            store.getKind(name);
            return true;
        } catch (DatasetNotFoundException e) {
            LoggingUtil.debug("Cannot resolve " + name + ": " + e.getMessage());
            return false;
        }
    }

    private boolean datasetExists(String fullPath, DatasetKind kind) {
        if (fullPath == null || fullPath.trim().isEmpty()) {
            return false;
        }
        DatasetPath path = DatasetPath.parse(fullPath);

        // Single files (shapefiles, dbf, csv) live directly on disk
        if (path.isSingleFile()) {
            return Files.exists(path.toFilePath());
        }

        // Remote database connections are not checked up front
        if (path.isRemoteWorkspace()) {
            return true;
        }

        try {
            return store.nameExists(path.getWorkspace(), kind, path.getName());
        } catch (FeatureStoreException e) {
            LoggingUtil.debug("Cannot open workspace " + path.getWorkspace() + ": " + e.getMessage());
            return false;
        }
    }
}
