package com.sitesearch.search;

import com.sitesearch.export.*;
import com.sitesearch.store.*;
import com.sitesearch.util.ArchiveUtil;
import com.sitesearch.util.LoggingUtil;
import com.sitesearch.util.MapLayerConfig;
import com.sitesearch.util.SearchConfig;
import com.sitesearch.util.SearchConfig.CombinedSitesOption;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Runs data searches: buffers a search site and exports what each configured layer has
 * inside the buffer.
 *
 * Usage: {@code DataSearchRunner <reference> <bufferSize> [siteName] [configFile] [layer,layer,...]}
 */
public class DataSearchRunner implements AutoCloseable {
    static final String TEMP_MASTER_NAME = "TempMaster";
    static final String CSV_FORMAT = "csv";

    private final SearchConfig config;
    private final MapSession session;
    private final InMemoryFeatureStore store;
    private final OperationRunner runner;
    private final SelectionExporter exporter;
    private final PostExportHook hook;

    private String tempWorkspace;
    private boolean searchErrors;

    /** Names derived from one search request. */
    static class SearchNames {
        String reference;
        String siteName;
        String shortRef;
        String subref;
        String radius;
        Path outputFolder;
        String bufferLayerName;
        String combinedSitesFile;
        CombinedSitesOption combinedSitesOption;

        String substitute(String text, String repChar) {
            return SearchStrings.stripIllegals(
                    SearchStrings.replaceSearchStrings(text, reference, siteName, shortRef, subref, radius), repChar);
        }
    }

    public DataSearchRunner(SearchConfig config) {
        this(config, UserNotifier.NONE);
    }

    public DataSearchRunner(SearchConfig config, UserNotifier notifier) {
        this.config = config;
        this.session = new MapSession();
        this.store = new InMemoryFeatureStore(session);
        this.runner = new OperationRunner(store, config.getPollIntervalMillis());
        this.exporter = new SelectionExporter(store, session, runner, notifier);
        this.hook = new PostExportHook(config.getPostExportLauncher());
    }

    public MapSession getSession() {
        return session;
    }

    public InMemoryFeatureStore getStore() {
        return store;
    }

    /**
     * Load every configured source file into the source workspace and add it to the session,
     * feature classes as layers and the rest as tables.
     */
    public void loadSources() throws IOException, FeatureStoreException {
        String sourceWorkspace = config.resolvePath(config.getSourceWorkspace());
        store.createWorkspace(sourceWorkspace);
        WktCsvLoader loader = new WktCsvLoader(store);

        for (Map.Entry<String, SearchConfig.SourceConfig> source : config.getSources().entrySet()) {
            String name = source.getKey();
            Path file = Paths.get(config.resolvePath(source.getValue().getFile()));
            DatasetPath path = DatasetPath.of(sourceWorkspace, name);
            Dataset dataset = loader.load(file, path, source.getValue().getGeometryColumn());
            if (dataset.getKind() == DatasetKind.FEATURE_CLASS) {
                session.addLayer(name, path);
            } else {
                session.addTable(name, path);
            }
        }
        LoggingUtil.info("Loaded " + config.getSources().size() + " source(s)");
    }

    /**
     * Run one search.
     *
     * @return true if every layer was processed without error
     */
    public boolean runSearch(SearchRequest request) {
        searchErrors = false;
        String repChar = config.getRepChar();
        String searchLayer = config.getSearchLayer();

        if (!session.isLayerLoaded(searchLayer)) {
            LoggingUtil.error("Search layer " + searchLayer + " is not loaded");
            return false;
        }

        SearchNames names = new SearchNames();
        try {
            String clause = config.getReferenceColumn() + " = '" + request.getReference().trim().replace("'", "''") + "'";
            runner.run(EngineOperation.SELECT_BY_ATTRIBUTE, searchLayer, clause, "NEW_SELECTION");
            if (session.getSelectionCount(searchLayer) == 0) {
                LoggingUtil.error("Search reference " + request.getReference() + " not found in " + searchLayer);
                return false;
            }

            String siteName = request.getSiteName();
            if (siteName.trim().isEmpty()) {
                siteName = readSiteName(searchLayer);
            }
            names.siteName = SearchStrings.stripIllegals(siteName.trim(), repChar);
        } catch (FeatureStoreException e) {
            LoggingUtil.error("Cannot select search site " + request.getReference() + ": " + e.getMessage());
            return false;
        }

        names.reference = SearchStrings.reference(request.getReference(), repChar);
        names.shortRef = SearchStrings.keepNumbersAndSpaces(names.reference, repChar);
        names.subref = SearchStrings.getSubref(names.shortRef, repChar);
        names.radius = request.getBufferSize().trim() + config.getBufferUnitShort();

        try {
            String folder = SearchStrings.replaceSearchStrings(config.getOutputFolder(), names.reference,
                    names.siteName, names.shortRef, names.subref, names.radius).trim();
            names.outputFolder = Paths.get(config.resolvePath(folder));
            Files.createDirectories(names.outputFolder);
        } catch (IOException e) {
            LoggingUtil.error("Cannot create output folder: " + e.getMessage(), e);
            return false;
        }

        Path logFile = names.outputFolder.resolve(names.substitute(config.getLogFileName(), repChar));
        if (request.isClearLogFile()) {
            try {
                Files.deleteIfExists(logFile);
            } catch (IOException e) {
                LoggingUtil.error("Cannot clear log file " + logFile + ": " + e.getMessage());
                return false;
            }
        }
        LoggingUtil.reinitialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(), logFile.toString());
        LoggingUtil.info("Data search started for " + names.reference + " (" + names.siteName + "), radius "
                + names.radius);

        tempWorkspace = config.resolvePath(config.getTempWorkspace());
        store.createWorkspace(tempWorkspace);

        names.combinedSitesOption = request.getCombinedSitesOption() != null
                ? request.getCombinedSitesOption() : config.getCombinedSitesOption();
        names.combinedSitesFile = names.outputFolder.resolve(
                names.substitute(config.getCombinedSitesTable(), repChar) + "." + CSV_FORMAT).toString();
        if (!prepareCombinedSites(names)) {
            return false;
        }

        names.bufferLayerName = names.substitute(config.getBufferOutputName(), repChar);
        String bufferPath = config.isKeepBuffer()
                ? names.outputFolder.resolve(names.bufferLayerName + ".shp").toString()
                : DatasetPath.of(tempWorkspace, names.bufferLayerName).getFullPath();

        try (TemporaryResources searchTemporaries = exporter.newTemporaryResources()) {
            if (!config.isKeepBuffer()) {
                searchTemporaries.track(bufferPath);
            }
            try {
                bufferSearchSite(searchLayer, request.getBufferSize(), bufferPath, names);
            } catch (OperationFailedException e) {
                LoggingUtil.error("Error during feature buffering: " + e.getFullMessage());
                return false;
            }

            for (MapLayerConfig layer : selectedLayers(request)) {
                if (!processLayer(layer, names)) {
                    searchErrors = true;
                }
            }

            session.clearSelection(searchLayer);
        }

        if (config.isArchiveEnabled()) {
            try {
                Path archive = ArchiveUtil.archiveOutputFolder(names.outputFolder, config.getArchiveSuffix(),
                        config.getArchivePassword());
                LoggingUtil.info("Output archived to " + archive);
            } catch (IOException e) {
                LoggingUtil.error("Could not archive " + names.outputFolder + ": " + e.getMessage(), e);
                searchErrors = true;
            }
        }

        if (searchErrors) {
            LoggingUtil.warn("Data search completed with errors");
        } else {
            LoggingUtil.info("Data search completed successfully");
        }
        return !searchErrors;
    }

    private String readSiteName(String searchLayer) throws FeatureStoreException {
        String siteColumn = config.getSiteColumn();
        try (RowCursor cursor = store.search(searchLayer)) {
            if (cursor.hasNext()) {
                Object value = cursor.getValue(cursor.next(), siteColumn);
                if (value != null) {
                    return Values.toText(value);
                }
            }
        }
        LoggingUtil.warn("No site name found in column " + siteColumn);
        return "";
    }

    private boolean prepareCombinedSites(SearchNames names) {
        CombinedSitesOption option = names.combinedSitesOption;
        if (option == CombinedSitesOption.NONE) {
            return true;
        }
        boolean exists = Files.exists(Paths.get(names.combinedSitesFile));
        if (option == CombinedSitesOption.OVERWRITE || !exists) {
            if (!exporter.getSerializer().writeEmptyCsv(names.combinedSitesFile, config.getCombinedSitesColumns())) {
                LoggingUtil.error("Cannot create combined sites table " + names.combinedSitesFile);
                return false;
            }
            LoggingUtil.info("Combined sites table " + names.combinedSitesFile + " created");
        }
        return true;
    }

    private void bufferSearchSite(String searchLayer, String bufferSize, String bufferPath, SearchNames names)
            throws OperationFailedException {
        double size;
        try {
            size = Double.parseDouble(bufferSize.trim()) * config.getBufferUnitFactor();
        } catch (NumberFormatException e) {
            throw new OperationFailedException(OperationRequest.of(EngineOperation.BUFFER, searchLayer),
                    OperationStatus.FAILED, "Invalid buffer size " + bufferSize, Collections.emptyList());
        }
        // Zero gives no polygon to search with
        String distance = size == 0 ? "0.01" : String.valueOf(size);

        LoggingUtil.info("Buffering feature(s) with a distance of " + names.radius);
        runner.run(EngineOperation.BUFFER, searchLayer, bufferPath, distance, "ALL");
        while (session.removeLayer(names.bufferLayerName)) {
            LoggingUtil.debug("Replacing layer " + names.bufferLayerName);
        }
        session.addLayer(names.bufferLayerName, DatasetPath.parse(bufferPath));
    }

    private List<MapLayerConfig> selectedLayers(SearchRequest request) {
        if (request.getLayers().isEmpty()) {
            return new ArrayList<>(config.getLayers().values());
        }
        List<MapLayerConfig> selected = new ArrayList<>();
        for (String name : request.getLayers()) {
            MapLayerConfig layer = config.getLayers().get(name);
            if (layer == null) {
                LoggingUtil.warn("Layer " + name + " is not configured, skipped");
                searchErrors = true;
            } else {
                selected.add(layer);
            }
        }
        return selected;
    }

    /**
     * Select, copy and export one layer.
     *
     * @return false if any step failed
     */
    boolean processLayer(MapLayerConfig layer, SearchNames names) {
        String repChar = config.getRepChar();
        String layerName = layer.getLayerName();
        String outputName = names.substitute(layer.getGisOutputName(), repChar);
        String tableOutputName = names.substitute(layer.getTableOutputName(), repChar);
        String format = layer.getFormat();

        String statistics = SearchStrings.alignStatisticsColumns(layer.getColumns(), layer.getStatisticsColumns(),
                layer.getGroupColumns());
        String combinedStatistics = SearchStrings.alignStatisticsColumns(layer.getCombinedSitesColumns(),
                layer.getCombinedSitesStatisticsColumns(), layer.getCombinedSitesGroupColumns());

        LoggingUtil.info("Starting analysis for " + layer.getNodeName());
        if (!session.isLayerLoaded(layerName)) {
            LoggingUtil.error("Layer " + layerName + " is not loaded");
            return false;
        }

        String tempMaster = DatasetPath.of(tempWorkspace, TEMP_MASTER_NAME).getFullPath();
        try (TemporaryResources layerTemporaries = exporter.newTemporaryResources().track(tempMaster)) {
            runner.run(EngineOperation.SELECT_BY_LOCATION, layerName, names.bufferLayerName, "NEW_SELECTION");
            if (session.getSelectionCount(layerName) > 0 && !layer.getCriteria().trim().isEmpty()) {
                LoggingUtil.info("Refining selection with criteria " + layer.getCriteria());
                runner.run(EngineOperation.SELECT_BY_ATTRIBUTE, layerName, layer.getCriteria(), "SUBSET_SELECTION");
            }

            int featureCount = session.getSelectionCount(layerName);
            if (featureCount > 0) {
                LoggingUtil.info(featureCount + " feature(s) found");
                createMapOutput(layerName, names.bufferLayerName, tempMaster, layer.getOutputType());

                String radiusText = layer.isIncludeRadius() ? names.radius : DerivedFieldCalculator.NO_RADIUS;

                if (!format.isEmpty() && !layer.getColumns().trim().isEmpty()) {
                    String tableFile = names.outputFolder.resolve(tableOutputName + "." + format).toString();
                    ExportRequest export = newExportRequest(tableFile, layer, radiusText);
                    export.setColumns(layer.getColumns());
                    export.setGroupColumns(layer.getGroupColumns());
                    export.setStatisticsColumns(statistics);
                    export.setOrderColumns(layer.getOrderColumns());
                    export.setIncludeHeaders(CSV_FORMAT.equalsIgnoreCase(format));

                    int rowCount = exporter.exportSelectionToCsv(export);
                    if (rowCount < 0) {
                        LoggingUtil.error("Error extracting summary from " + tempMaster);
                        return false;
                    }
                    LoggingUtil.info(rowCount + " record(s) exported");
                }

                if (layer.isKeepLayer() && !outputName.isEmpty()) {
                    String outputFile = names.outputFolder.resolve(outputName + ".shp").toString();
                    runner.run(EngineOperation.COPY_FEATURES, TEMP_MASTER_NAME, outputFile);
                    LoggingUtil.info("Output layer saved to " + outputFile);
                }

                if (!layer.getCombinedSitesColumns().trim().isEmpty()
                        && names.combinedSitesOption != CombinedSitesOption.NONE) {
                    ExportRequest export = newExportRequest(names.combinedSitesFile, layer, radiusText);
                    export.setColumns(layer.getCombinedSitesColumns());
                    export.setGroupColumns(layer.getCombinedSitesGroupColumns());
                    export.setStatisticsColumns(combinedStatistics);
                    export.setOrderColumns(layer.getCombinedSitesOrderColumns());
                    export.setOverwrite(false);
                    export.setIncludeHeaders(false);

                    int rowCount = exporter.exportSelectionToCsv(export);
                    if (rowCount < 0) {
                        LoggingUtil.error("Error extracting summary for combined sites table from " + tempMaster);
                        return false;
                    }
                    LoggingUtil.info(rowCount + " row(s) added to combined sites table");
                }

                session.clearSelection(layerName);
                LoggingUtil.info("Analysis complete");
            } else {
                LoggingUtil.info("No features found");
            }
        } catch (OperationFailedException e) {
            LoggingUtil.error("Error processing layer " + layerName + ": " + e.getFullMessage());
            return false;
        } catch (FeatureStoreException e) {
            LoggingUtil.error("Error processing layer " + layerName + ": " + e.getMessage());
            return false;
        }

        if (!layer.getMacroName().trim().isEmpty()) {
            LoggingUtil.info("Executing post-export script " + layer.getMacroName());
            String script = resolveScript(layer.getMacroName());
            if (!hook.run(script, names.outputFolder.toString(), tableOutputName + "." + format, tableOutputName)) {
                LoggingUtil.error("Error executing post-export script " + layer.getMacroName());
                return false;
            }
        }
        return true;
    }

    private ExportRequest newExportRequest(String outputPath, MapLayerConfig layer, String radiusText) {
        ExportRequest export = new ExportRequest(TEMP_MASTER_NAME, outputPath);
        export.setTempFeatureClass(DatasetPath.of(tempWorkspace, config.getTempOutputName()).getFullPath());
        export.setTempTable(DatasetPath.of(tempWorkspace, config.getTempTableName()).getFullPath());
        export.setIncludeArea(layer.isIncludeArea());
        export.setAreaUnit(config.getAreaMeasureUnit());
        export.setIncludeDistance(layer.isIncludeDistance());
        export.setTargetLayer(config.getSearchLayer());
        export.setRadius(radiusText);
        export.setRenameColumns(true);
        return export;
    }

    /**
     * Clip polygons and lines to the buffer; anything else is copied whole.
     */
    private void createMapOutput(String layerName, String bufferLayerName, String tempMaster,
                                 MapLayerConfig.OutputType outputType) throws FeatureStoreException {
        GeometryKind layerKind = store.sampleGeometryKind(layerName);
        GeometryKind bufferKind = store.sampleGeometryKind(bufferLayerName);
        boolean clip = outputType == MapLayerConfig.OutputType.CLIP
                && ((layerKind == GeometryKind.POLYGON && bufferKind == GeometryKind.POLYGON)
                || (layerKind == GeometryKind.LINE
                && (bufferKind == GeometryKind.LINE || bufferKind == GeometryKind.POLYGON)));

        if (clip) {
            LoggingUtil.info("Clipping selected features ...");
            runner.run(EngineOperation.CLIP, layerName, bufferLayerName, tempMaster);
        } else {
            LoggingUtil.info("Copying selected features ...");
            runner.run(EngineOperation.COPY_FEATURES, layerName, tempMaster);
        }
        session.addLayer(TEMP_MASTER_NAME, DatasetPath.parse(tempMaster));
    }

    private String resolveScript(String macroName) {
        if (new File(macroName).isAbsolute()) {
            return macroName;
        }
        return new File(config.resolvePath(config.getScriptFolder()), macroName).getPath();
    }

    @Override
    public void close() {
        store.close();
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: DataSearchRunner <reference> <bufferSize> [siteName] [configFile] [layers]");
            System.exit(2);
        }

        Properties defaultProps = new Properties();
        try (InputStream in = DataSearchRunner.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null) {
                defaultProps.load(in);
            } else {
                LoggingUtil.info("Default properties file not found, using built-in defaults");
            }
        } catch (IOException e) {
            LoggingUtil.error("Error loading default properties: " + e.getMessage());
        }

        String siteName = args.length > 2 ? args[2] : "";
        String configFile = args.length > 3 ? args[3] : defaultProps.getProperty("config.file", "DataSearches.json");
        List<String> layers = args.length > 4
                ? ColumnSpec.splitColumns(args[4]) : Collections.<String>emptyList();

        boolean success;
        try {
            SearchConfig config = new SearchConfig(configFile);
            LoggingUtil.initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(), null);
            config.printDebug();

            try (DataSearchRunner searchRunner = new DataSearchRunner(config)) {
                searchRunner.loadSources();
                SearchRequest request = new SearchRequest(args[0], args[1])
                        .setSiteName(siteName)
                        .setLayers(layers);
                success = searchRunner.runSearch(request);
            }
        } catch (IOException | FeatureStoreException e) {
            LoggingUtil.error("Data search failed: " + e.getMessage(), e);
            success = false;
        } finally {
            LoggingUtil.close();
        }
        System.exit(success ? 0 : 1);
    }
}
