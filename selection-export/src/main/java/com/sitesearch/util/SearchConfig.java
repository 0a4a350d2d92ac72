package com.sitesearch.util;

import java.io.*;
import java.util.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.sitesearch.store.OperationRunner;

/**
 * SearchConfig - loads the data search tool configuration from a JSON file.
 * Any section missing from the file keeps its defaults.
 */
public class SearchConfig {

    // What happens to the combined sites table at the start of a search
    public enum CombinedSitesOption {
        NONE,       // no combined sites table
        APPEND,     // add to an existing table, creating it if missing
        OVERWRITE   // start a new table with just a header
    }

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;

    // Engine configuration
    private long pollIntervalMillis = OperationRunner.DEFAULT_POLL_INTERVAL_MILLIS;

    // Workspace configuration
    private String outputFolder = "output/%shortref%_%sitename%";
    private String tempWorkspace = "temp/TempData.gdb";
    private String tempOutputName = "TempOutput";
    private String tempTableName = "TempTable";
    private String logFileName = "DataSearch_%subref%.log";
    private String repChar = "_";
    private String sourceWorkspace = "sources.gdb";

    // Search configuration
    private String searchLayer = "Search Sites";
    private String referenceColumn = "Ref";
    private String siteColumn = "Sitename";
    private String radiusColumn = "";
    private String bufferUnit = "Meters";
    private String bufferUnitShort = "m";
    private double bufferUnitFactor = 1.0;
    private String bufferOutputName = "%shortref%_Buffer";
    private boolean keepBuffer = true;
    private String areaMeasureUnit = "ha";

    // Sources to load, keyed by layer name
    private Map<String, SourceConfig> sources = new LinkedHashMap<>();

    // Combined sites configuration
    private CombinedSitesOption combinedSitesOption = CombinedSitesOption.NONE;
    private String combinedSitesTable = "%shortref%_combined_sites";
    private String combinedSitesColumns = "Site_Type,Site_Name,Site_Area,Map_Label";

    // Layers in search order
    private Map<String, MapLayerConfig> layers = new LinkedHashMap<>();

    // Post-export script configuration
    private List<String> postExportLauncher = new ArrayList<>();
    private String scriptFolder = "scripts";

    // Archive configuration
    private boolean archiveEnabled = false;
    private String archiveSuffix = "_archive";
    private String archivePassword = null;

    private String configFilePath = null;

    // Raw JSON config
    private JsonNode configJson;

    /** Where a source layer's data comes from. */
    public static class SourceConfig {
        private final String file;
        private final String geometryColumn;

        public SourceConfig(String file, String geometryColumn) {
            this.file = file;
            this.geometryColumn = geometryColumn;
        }

        public String getFile() {
            return file;
        }

        public String getGeometryColumn() {
            return geometryColumn;
        }
    }

    /**
     * Default constructor
     */
    public SearchConfig() {
    }

    /**
     * Constructor that loads from file
     */
    public SearchConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Load configuration from JSON file
     */
    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Search config file not found: " + configFilePath);
            LoggingUtil.info("Using default search configuration");
            return;
        }
        this.configFilePath = configFile.getAbsolutePath();

        ObjectMapper mapper = new ObjectMapper();
        configJson = mapper.readTree(configFile);

        // Parse logging configuration
        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");

            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }
            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }
        }

        // Parse engine configuration
        if (configJson.has("engine")) {
            JsonNode engineNode = configJson.get("engine");

            if (engineNode.has("pollIntervalMillis")) {
                long interval = engineNode.get("pollIntervalMillis").asLong();
                if (interval > 0) {
                    pollIntervalMillis = interval;
                } else {
                    LoggingUtil.warn("Invalid poll interval " + interval + ", using " + pollIntervalMillis);
                }
            }
        }

        // Parse workspace configuration
        if (configJson.has("workspace")) {
            JsonNode workspaceNode = configJson.get("workspace");

            if (workspaceNode.has("outputFolder")) {
                outputFolder = workspaceNode.get("outputFolder").asText();
            }
            if (workspaceNode.has("tempWorkspace")) {
                tempWorkspace = workspaceNode.get("tempWorkspace").asText();
            }
            if (workspaceNode.has("tempOutputName")) {
                tempOutputName = workspaceNode.get("tempOutputName").asText();
            }
            if (workspaceNode.has("tempTableName")) {
                tempTableName = workspaceNode.get("tempTableName").asText();
            }
            if (workspaceNode.has("logFileName")) {
                logFileName = workspaceNode.get("logFileName").asText();
            }
            if (workspaceNode.has("repChar")) {
                repChar = workspaceNode.get("repChar").asText();
            }
            if (workspaceNode.has("sourceWorkspace")) {
                sourceWorkspace = workspaceNode.get("sourceWorkspace").asText();
            }
        }

        // Parse search configuration
        if (configJson.has("search")) {
            JsonNode searchNode = configJson.get("search");

            if (searchNode.has("layerName")) {
                searchLayer = searchNode.get("layerName").asText();
            }
            if (searchNode.has("referenceColumn")) {
                referenceColumn = searchNode.get("referenceColumn").asText();
            }
            if (searchNode.has("siteColumn")) {
                siteColumn = searchNode.get("siteColumn").asText();
            }
            if (searchNode.has("radiusColumn")) {
                radiusColumn = searchNode.get("radiusColumn").asText();
            }
            if (searchNode.has("bufferUnit")) {
                bufferUnit = searchNode.get("bufferUnit").asText();
            }
            if (searchNode.has("bufferUnitShort")) {
                bufferUnitShort = searchNode.get("bufferUnitShort").asText();
            }
            if (searchNode.has("bufferUnitFactor")) {
                bufferUnitFactor = searchNode.get("bufferUnitFactor").asDouble();
            }
            if (searchNode.has("bufferOutputName")) {
                bufferOutputName = searchNode.get("bufferOutputName").asText();
            }
            if (searchNode.has("keepBuffer")) {
                keepBuffer = searchNode.get("keepBuffer").asBoolean();
            }
            if (searchNode.has("areaMeasureUnit")) {
                areaMeasureUnit = searchNode.get("areaMeasureUnit").asText();
            }
        }

        // Parse source layers
        if (configJson.has("sources")) {
            JsonNode sourcesNode = configJson.get("sources");
            sources.clear();

            Iterator<String> names = sourcesNode.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                JsonNode sourceNode = sourcesNode.get(name);
                if (sourceNode.isTextual()) {
                    sources.put(name, new SourceConfig(sourceNode.asText(), "WKT"));
                } else {
                    String geometryColumn = sourceNode.has("geometryColumn")
                            ? sourceNode.get("geometryColumn").asText() : "WKT";
                    sources.put(name, new SourceConfig(sourceNode.path("file").asText(), geometryColumn));
                }
            }
            LoggingUtil.debug("Loaded " + sources.size() + " source layer definitions");
        }

        // Parse combined sites configuration
        if (configJson.has("combinedSites")) {
            JsonNode combinedNode = configJson.get("combinedSites");

            if (combinedNode.has("option")) {
                String option = combinedNode.get("option").asText().toUpperCase();
                try {
                    combinedSitesOption = CombinedSitesOption.valueOf(option);
                } catch (IllegalArgumentException e) {
                    LoggingUtil.warn("Invalid combined sites option: " + option + ", using " + combinedSitesOption);
                }
            }
            if (combinedNode.has("tableName")) {
                combinedSitesTable = combinedNode.get("tableName").asText();
            }
            if (combinedNode.has("columns")) {
                combinedSitesColumns = combinedNode.get("columns").asText();
            }
        }

        // Parse map layers
        if (configJson.has("layers")) {
            JsonNode layersNode = configJson.get("layers");
            layers.clear();

            Iterator<String> names = layersNode.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                layers.put(name, MapLayerConfig.fromJson(name, layersNode.get(name)));
            }
            LoggingUtil.info("Loaded " + layers.size() + " map layers from config");
        }

        // Parse post-export configuration
        if (configJson.has("postExport")) {
            JsonNode postExportNode = configJson.get("postExport");

            if (postExportNode.has("launcher")) {
                postExportLauncher = new ArrayList<>();
                JsonNode launcherNode = postExportNode.get("launcher");
                if (launcherNode.isArray()) {
                    for (JsonNode part : launcherNode) {
                        postExportLauncher.add(part.asText());
                    }
                } else if (!launcherNode.asText().trim().isEmpty()) {
                    postExportLauncher.addAll(Arrays.asList(launcherNode.asText().trim().split("\\s+")));
                }
            }
            if (postExportNode.has("scriptFolder")) {
                scriptFolder = postExportNode.get("scriptFolder").asText();
            }
        }

        // Parse archive configuration
        if (configJson.has("archive")) {
            JsonNode archiveNode = configJson.get("archive");

            if (archiveNode.has("enabled")) {
                archiveEnabled = archiveNode.get("enabled").asBoolean();
            }
            if (archiveNode.has("suffix")) {
                archiveSuffix = archiveNode.get("suffix").asText();
            }
            if (archiveNode.has("password")) {
                archivePassword = archiveNode.get("password").asText();
            }
        }

        LoggingUtil.info("Search configuration loaded from " + configFilePath);
    }

    /**
     * Resolve a path from the config against the folder the config file lives in.
     */
    public String resolvePath(String path) {
        if (path == null || path.isEmpty() || configFilePath == null || new File(path).isAbsolute()) {
            return path;
        }
        return new File(new File(configFilePath).getParentFile(), path).getPath();
    }

    /**
     * Debug dump of the main settings
     */
    public void printDebug() {
        if (!LoggingUtil.isDebugEnabled()) {
            return;
        }
        LoggingUtil.debug("Search configuration:");
        LoggingUtil.debug("  outputFolder=" + outputFolder + ", tempWorkspace=" + tempWorkspace);
        LoggingUtil.debug("  searchLayer=" + searchLayer + ", referenceColumn=" + referenceColumn
                + ", siteColumn=" + siteColumn);
        LoggingUtil.debug("  bufferUnit=" + bufferUnit + " (" + bufferUnitShort + ", x" + bufferUnitFactor + ")");
        LoggingUtil.debug("  combinedSites=" + combinedSitesOption + ", layers=" + layers.keySet());
        LoggingUtil.debug("  pollIntervalMillis=" + pollIntervalMillis + ", archive=" + archiveEnabled);
    }

    // Getters and setters

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public void setPollIntervalMillis(long pollIntervalMillis) {
        this.pollIntervalMillis = pollIntervalMillis;
    }

    public String getOutputFolder() {
        return outputFolder;
    }

    public void setOutputFolder(String outputFolder) {
        this.outputFolder = outputFolder;
    }

    public String getTempWorkspace() {
        return tempWorkspace;
    }

    public void setTempWorkspace(String tempWorkspace) {
        this.tempWorkspace = tempWorkspace;
    }

    public String getTempOutputName() {
        return tempOutputName;
    }

    public String getTempTableName() {
        return tempTableName;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    public String getRepChar() {
        return repChar;
    }

    public String getSourceWorkspace() {
        return sourceWorkspace;
    }

    public void setSourceWorkspace(String sourceWorkspace) {
        this.sourceWorkspace = sourceWorkspace;
    }

    public String getSearchLayer() {
        return searchLayer;
    }

    public void setSearchLayer(String searchLayer) {
        this.searchLayer = searchLayer;
    }

    public String getReferenceColumn() {
        return referenceColumn;
    }

    public void setReferenceColumn(String referenceColumn) {
        this.referenceColumn = referenceColumn;
    }

    public String getSiteColumn() {
        return siteColumn;
    }

    public String getRadiusColumn() {
        return radiusColumn;
    }

    public String getBufferUnit() {
        return bufferUnit;
    }

    public String getBufferUnitShort() {
        return bufferUnitShort;
    }

    public double getBufferUnitFactor() {
        return bufferUnitFactor;
    }

    public String getBufferOutputName() {
        return bufferOutputName;
    }

    public boolean isKeepBuffer() {
        return keepBuffer;
    }

    public String getAreaMeasureUnit() {
        return areaMeasureUnit;
    }

    public Map<String, SourceConfig> getSources() {
        return sources;
    }

    public void addSource(String layerName, String file, String geometryColumn) {
        sources.put(layerName, new SourceConfig(file, geometryColumn));
    }

    public CombinedSitesOption getCombinedSitesOption() {
        return combinedSitesOption;
    }

    public void setCombinedSitesOption(CombinedSitesOption combinedSitesOption) {
        this.combinedSitesOption = combinedSitesOption;
    }

    public String getCombinedSitesTable() {
        return combinedSitesTable;
    }

    public String getCombinedSitesColumns() {
        return combinedSitesColumns;
    }

    public void setCombinedSitesColumns(String combinedSitesColumns) {
        this.combinedSitesColumns = combinedSitesColumns;
    }

    public Map<String, MapLayerConfig> getLayers() {
        return layers;
    }

    public void addLayer(MapLayerConfig layer) {
        layers.put(layer.getNodeName(), layer);
    }

    public List<String> getPostExportLauncher() {
        return postExportLauncher;
    }

    public void setPostExportLauncher(List<String> postExportLauncher) {
        this.postExportLauncher = new ArrayList<>(postExportLauncher);
    }

    public String getScriptFolder() {
        return scriptFolder;
    }

    public void setScriptFolder(String scriptFolder) {
        this.scriptFolder = scriptFolder;
    }

    public boolean isArchiveEnabled() {
        return archiveEnabled;
    }

    public void setArchiveEnabled(boolean archiveEnabled) {
        this.archiveEnabled = archiveEnabled;
    }

    public String getArchiveSuffix() {
        return archiveSuffix;
    }

    public String getArchivePassword() {
        return archivePassword;
    }

    public void setArchivePassword(String archivePassword) {
        this.archivePassword = archivePassword;
    }

    public JsonNode getConfigJson() {
        return configJson;
    }
}
