package com.sitesearch.export;

import com.sitesearch.store.*;
import com.sitesearch.util.LoggingUtil;

/**
 * Adds the derived Area, Distance and Radius fields.
 * Every method lets engine failures escape; the caller aborts the export on them.
 */
public class DerivedFieldCalculator {
    public static final String AREA_FIELD = "Area";
    public static final String DISTANCE_FIELD = "Distance";
    public static final String RADIUS_FIELD = "Radius";
    public static final String NO_RADIUS = "none";

    static final int AREA_FIELD_LENGTH = 20;
    static final int RADIUS_FIELD_LENGTH = 25;

    private final FeatureStore store;
    private final SchemaValidator validator;
    private final OperationRunner runner;

    public DerivedFieldCalculator(FeatureStore store, SchemaValidator validator, OperationRunner runner) {
        this.store = store;
        this.validator = validator;
        this.runner = runner;
    }

    /**
     * Calculate polygon areas into an Area field, adding the field when missing.
     * Only polygon layers (judged by their first feature) get an area.
     *
     * @return true if this call added the Area field
     */
    public boolean addArea(String dataset, AreaUnit unit) throws FeatureStoreException {
        GeometryKind kind = store.sampleGeometryKind(dataset);
        if (kind != GeometryKind.POLYGON) {
            LoggingUtil.debug("No area calculated for " + dataset + ": geometry is " + kind);
            return false;
        }

        boolean added = false;
        if (!validator.fieldExists(dataset, AREA_FIELD)) {
            runner.run(EngineOperation.ADD_FIELD, dataset, AREA_FIELD, FieldType.DOUBLE.name(),
                    String.valueOf(AREA_FIELD_LENGTH));
            added = true;
        }
        runner.run(EngineOperation.CALCULATE_GEOMETRY, dataset, AREA_FIELD, "AREA", unit.getOperationUnit());
        LoggingUtil.debug("Area calculated in " + unit.getCode() + " for " + dataset);
        return added;
    }

    /**
     * Remove a field added earlier by {@link #addArea}.
     */
    public void removeArea(String dataset) throws FeatureStoreException {
        if (validator.fieldExists(dataset, AREA_FIELD)) {
            runner.run(EngineOperation.DELETE_FIELD, dataset, AREA_FIELD);
        }
    }

    /**
     * Join each input feature to its nearest target feature into a new feature class,
     * recording the separation in a Distance field. Inputs without a target get null.
     */
    public void addDistance(String input, String target, String output) throws FeatureStoreException {
        runner.run(EngineOperation.SPATIAL_JOIN, input, target, output,
                "JOIN_ONE_TO_ONE", "KEEP_ALL", "CLOSEST", "", DISTANCE_FIELD);
        LoggingUtil.debug("Distances to " + target + " written to " + output);
    }

    /**
     * Write the radius literal into every row's Radius field, unless the radius is "none".
     *
     * @return true if the radius was written
     */
    public boolean addRadius(String dataset, String radius) throws FeatureStoreException {
        if (isNoRadius(radius)) {
            return false;
        }
        if (!validator.fieldExists(dataset, RADIUS_FIELD)) {
            runner.run(EngineOperation.ADD_FIELD, dataset, RADIUS_FIELD, FieldType.STRING.name(),
                    String.valueOf(RADIUS_FIELD_LENGTH));
        }
        runner.run(EngineOperation.CALCULATE_FIELD, dataset, RADIUS_FIELD, "\"" + radius + "\"");
        return true;
    }

    public static boolean isNoRadius(String radius) {
        return radius == null || radius.trim().isEmpty() || NO_RADIUS.equalsIgnoreCase(radius.trim());
    }
}
