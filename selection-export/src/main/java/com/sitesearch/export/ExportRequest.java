package com.sitesearch.export;

/**
 * Settings for one export of a layer selection. Created per export and discarded afterwards.
 */
public class ExportRequest {
    private String layerName;
    private String outputPath;
    private String tempFeatureClass;
    private String tempTable;

    private String columns = "";
    private String groupColumns = "";
    private String statisticsColumns = "";
    private String orderColumns = "";

    private boolean includeArea = false;
    private String areaUnit = AreaUnit.HECTARES.getCode();
    private boolean includeDistance = false;
    private String targetLayer = "";
    private String radius = DerivedFieldCalculator.NO_RADIUS;

    private boolean overwrite = true;
    private boolean includeHeaders = true;
    private boolean renameColumns = false;
    private boolean checkForSelection = false;
    private boolean notifyUser = false;

    public ExportRequest(String layerName, String outputPath) {
        this.layerName = layerName;
        this.outputPath = outputPath;
    }

    public String getLayerName() {
        return layerName;
    }

    public void setLayerName(String layerName) {
        this.layerName = layerName;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    /** Full path of the working copy of the selection. */
    public String getTempFeatureClass() {
        return tempFeatureClass;
    }

    public void setTempFeatureClass(String tempFeatureClass) {
        this.tempFeatureClass = tempFeatureClass;
    }

    /** Full path of the statistics table. */
    public String getTempTable() {
        return tempTable;
    }

    public void setTempTable(String tempTable) {
        this.tempTable = tempTable;
    }

    public String getColumns() {
        return columns;
    }

    public void setColumns(String columns) {
        this.columns = columns == null ? "" : columns;
    }

    public String getGroupColumns() {
        return groupColumns;
    }

    public void setGroupColumns(String groupColumns) {
        this.groupColumns = groupColumns == null ? "" : groupColumns;
    }

    public String getStatisticsColumns() {
        return statisticsColumns;
    }

    public void setStatisticsColumns(String statisticsColumns) {
        this.statisticsColumns = statisticsColumns == null ? "" : statisticsColumns;
    }

    public String getOrderColumns() {
        return orderColumns;
    }

    public void setOrderColumns(String orderColumns) {
        this.orderColumns = orderColumns == null ? "" : orderColumns;
    }

    public boolean isIncludeArea() {
        return includeArea;
    }

    public void setIncludeArea(boolean includeArea) {
        this.includeArea = includeArea;
    }

    public String getAreaUnit() {
        return areaUnit;
    }

    public void setAreaUnit(String areaUnit) {
        this.areaUnit = areaUnit;
    }

    public boolean isIncludeDistance() {
        return includeDistance;
    }

    public void setIncludeDistance(boolean includeDistance) {
        this.includeDistance = includeDistance;
    }

    public String getTargetLayer() {
        return targetLayer;
    }

    public void setTargetLayer(String targetLayer) {
        this.targetLayer = targetLayer;
    }

    /** Literal written to the Radius field, or "none". */
    public String getRadius() {
        return radius;
    }

    public void setRadius(String radius) {
        this.radius = radius;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public void setOverwrite(boolean overwrite) {
        this.overwrite = overwrite;
    }

    public boolean isIncludeHeaders() {
        return includeHeaders;
    }

    public void setIncludeHeaders(boolean includeHeaders) {
        this.includeHeaders = includeHeaders;
    }

    public boolean isRenameColumns() {
        return renameColumns;
    }

    public void setRenameColumns(boolean renameColumns) {
        this.renameColumns = renameColumns;
    }

    public boolean isCheckForSelection() {
        return checkForSelection;
    }

    public void setCheckForSelection(boolean checkForSelection) {
        this.checkForSelection = checkForSelection;
    }

    public boolean isNotifyUser() {
        return notifyUser;
    }

    public void setNotifyUser(boolean notifyUser) {
        this.notifyUser = notifyUser;
    }

    @Override
    public String toString() {
        return layerName + " -> " + outputPath;
    }
}
