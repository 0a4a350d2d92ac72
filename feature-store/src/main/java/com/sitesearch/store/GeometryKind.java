package com.sitesearch.store;

import org.locationtech.jts.geom.Geometry;

/**
 * Coarse geometry family used when deciding which derived fields apply.
 */
public enum GeometryKind {
    POINT,
    LINE,
    POLYGON,
    OTHER;

    public static GeometryKind of(Geometry geometry) {
        if (geometry == null) {
            return OTHER;
        }
        switch (geometry.getGeometryType()) {
            case "Point":
            case "MultiPoint":
                return POINT;
            case "LineString":
            case "LinearRing":
            case "MultiLineString":
                return LINE;
            case "Polygon":
            case "MultiPolygon":
                return POLYGON;
            default:
                return OTHER;
        }
    }
}
