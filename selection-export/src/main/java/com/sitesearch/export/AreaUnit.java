package com.sitesearch.export;

/**
 * Units offered for the derived Area field.
 */
public enum AreaUnit {
    HECTARES("ha", "HECTARES"),
    SQUARE_METERS("m2", "SQUARE_METERS"),
    SQUARE_KILOMETERS("km2", "SQUARE_KILOMETERS");

    private final String code;
    private final String operationUnit;

    AreaUnit(String code, String operationUnit) {
        this.code = code;
        this.operationUnit = operationUnit;
    }

    public String getCode() {
        return code;
    }

    /** Unit keyword passed to the geometry calculation. */
    public String getOperationUnit() {
        return operationUnit;
    }

    /**
     * @return the unit for a code such as "ha" or "KM2", or null if unknown
     */
    public static AreaUnit fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AreaUnit unit : values()) {
            if (unit.code.equalsIgnoreCase(code.trim())) {
                return unit;
            }
        }
        return null;
    }
}
