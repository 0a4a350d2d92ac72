package com.sitesearch.store;

/**
 * Operations a feature store can execute. Parameters are positional strings.
 */
public enum EngineOperation {
    /** in, out */
    COPY_FEATURES,
    /** in, out */
    COPY_TABLE,
    /** in, clipFeatures, out */
    CLIP,
    /** in, out, distance, dissolve (NONE | ALL) */
    BUFFER,
    /** targetLayer, searchFeatures, method (NEW_SELECTION | SUBSET_SELECTION) */
    SELECT_BY_LOCATION,
    /** layer, whereClause, method (NEW_SELECTION | SUBSET_SELECTION | CLEAR_SELECTION) */
    SELECT_BY_ATTRIBUTE,
    /** target, join, out, joinOperation, joinType, matchOption, searchRadius, distanceField */
    SPATIAL_JOIN,
    /** in, outTable, statisticsFields, caseFields */
    STATISTICS,
    /** in, out, dissolveFields, statisticsFields */
    DISSOLVE,
    /** in, fieldName, fieldType, fieldLength */
    ADD_FIELD,
    /** in, fieldName */
    DELETE_FIELD,
    /** in, fieldName, expression */
    CALCULATE_FIELD,
    /** in, fieldName, property (AREA), unit */
    CALCULATE_GEOMETRY,
    /** dataset */
    DELETE
}
