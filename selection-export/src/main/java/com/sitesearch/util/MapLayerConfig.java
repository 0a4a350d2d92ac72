package com.sitesearch.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Settings for one map layer taking part in a data search.
 */
public class MapLayerConfig {

    public enum OutputType {
        COPY,
        CLIP
    }

    private final String nodeName;
    private String layerName;
    private String gisOutputName = "";
    private String tableOutputName = "";
    private String columns = "";
    private String groupColumns = "";
    private String statisticsColumns = "";
    private String orderColumns = "";
    private String criteria = "";
    private boolean includeArea = false;
    private boolean includeDistance = false;
    private boolean includeRadius = false;
    private boolean keepLayer = false;
    private OutputType outputType = OutputType.COPY;
    private String format = "csv";
    private String macroName = "";
    private String combinedSitesColumns = "";
    private String combinedSitesGroupColumns = "";
    private String combinedSitesStatisticsColumns = "";
    private String combinedSitesOrderColumns = "";

    public MapLayerConfig(String nodeName) {
        this.nodeName = nodeName;
        this.layerName = nodeName;
    }

    /** Constructor with a layer node from the search configuration */
    public static MapLayerConfig fromJson(String nodeName, JsonNode node) {
        MapLayerConfig layer = new MapLayerConfig(nodeName);

        if (node.has("layerName")) {
            layer.layerName = node.get("layerName").asText();
        }
        if (node.has("gisOutputName")) {
            layer.gisOutputName = node.get("gisOutputName").asText();
        }
        if (node.has("tableOutputName")) {
            layer.tableOutputName = node.get("tableOutputName").asText();
        }
        if (node.has("columns")) {
            layer.columns = node.get("columns").asText();
        }
        if (node.has("groupColumns")) {
            layer.groupColumns = node.get("groupColumns").asText();
        }
        if (node.has("statisticsColumns")) {
            layer.statisticsColumns = node.get("statisticsColumns").asText();
        }
        if (node.has("orderColumns")) {
            layer.orderColumns = node.get("orderColumns").asText();
        }
        if (node.has("criteria")) {
            layer.criteria = node.get("criteria").asText();
        }
        if (node.has("includeArea")) {
            layer.includeArea = node.get("includeArea").asBoolean();
        }
        if (node.has("includeDistance")) {
            layer.includeDistance = node.get("includeDistance").asBoolean();
        }
        if (node.has("includeRadius")) {
            layer.includeRadius = node.get("includeRadius").asBoolean();
        }
        if (node.has("keepLayer")) {
            layer.keepLayer = node.get("keepLayer").asBoolean();
        }
        if (node.has("outputType")) {
            String type = node.get("outputType").asText().toUpperCase();
            try {
                layer.outputType = OutputType.valueOf(type);
            } catch (IllegalArgumentException e) {
                LoggingUtil.warn("Invalid output type for layer " + nodeName + ": " + type + ", using COPY");
            }
        }
        if (node.has("format")) {
            layer.format = node.get("format").asText().toLowerCase();
        }
        if (node.has("macroName")) {
            layer.macroName = node.get("macroName").asText();
        }

        // Parse combined sites configuration
        if (node.has("combinedSites")) {
            JsonNode combined = node.get("combinedSites");
            if (combined.has("columns")) {
                layer.combinedSitesColumns = combined.get("columns").asText();
            }
            if (combined.has("groupColumns")) {
                layer.combinedSitesGroupColumns = combined.get("groupColumns").asText();
            }
            if (combined.has("statisticsColumns")) {
                layer.combinedSitesStatisticsColumns = combined.get("statisticsColumns").asText();
            }
            if (combined.has("orderColumns")) {
                layer.combinedSitesOrderColumns = combined.get("orderColumns").asText();
            }
        }
        return layer;
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getLayerName() {
        return layerName;
    }

    public String getGisOutputName() {
        return gisOutputName;
    }

    public String getTableOutputName() {
        return tableOutputName;
    }

    public String getColumns() {
        return columns;
    }

    public void setColumns(String columns) {
        this.columns = columns;
    }

    public String getGroupColumns() {
        return groupColumns;
    }

    public void setGroupColumns(String groupColumns) {
        this.groupColumns = groupColumns;
    }

    public String getStatisticsColumns() {
        return statisticsColumns;
    }

    public void setStatisticsColumns(String statisticsColumns) {
        this.statisticsColumns = statisticsColumns;
    }

    public String getOrderColumns() {
        return orderColumns;
    }

    public void setOrderColumns(String orderColumns) {
        this.orderColumns = orderColumns;
    }

    public String getCriteria() {
        return criteria;
    }

    public void setCriteria(String criteria) {
        this.criteria = criteria;
    }

    public boolean isIncludeArea() {
        return includeArea;
    }

    public void setIncludeArea(boolean includeArea) {
        this.includeArea = includeArea;
    }

    public boolean isIncludeDistance() {
        return includeDistance;
    }

    public void setIncludeDistance(boolean includeDistance) {
        this.includeDistance = includeDistance;
    }

    public boolean isIncludeRadius() {
        return includeRadius;
    }

    public void setIncludeRadius(boolean includeRadius) {
        this.includeRadius = includeRadius;
    }

    public boolean isKeepLayer() {
        return keepLayer;
    }

    public void setKeepLayer(boolean keepLayer) {
        this.keepLayer = keepLayer;
    }

    public OutputType getOutputType() {
        return outputType;
    }

    public void setOutputType(OutputType outputType) {
        this.outputType = outputType;
    }

    public String getFormat() {
        return format;
    }

    public String getMacroName() {
        return macroName;
    }

    public void setMacroName(String macroName) {
        this.macroName = macroName;
    }

    public String getCombinedSitesColumns() {
        return combinedSitesColumns;
    }

    public void setCombinedSitesColumns(String combinedSitesColumns) {
        this.combinedSitesColumns = combinedSitesColumns;
    }

    public String getCombinedSitesGroupColumns() {
        return combinedSitesGroupColumns;
    }

    public String getCombinedSitesStatisticsColumns() {
        return combinedSitesStatisticsColumns;
    }

    public String getCombinedSitesOrderColumns() {
        return combinedSitesOrderColumns;
    }

    public void setLayerName(String layerName) {
        this.layerName = layerName;
    }

    public void setGisOutputName(String gisOutputName) {
        this.gisOutputName = gisOutputName;
    }

    public void setTableOutputName(String tableOutputName) {
        this.tableOutputName = tableOutputName;
    }

    @Override
    public String toString() {
        return nodeName + " (" + layerName + ")";
    }
}
