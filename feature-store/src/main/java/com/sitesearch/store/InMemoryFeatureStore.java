package com.sitesearch.store;

import com.sitesearch.util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Feature store held in memory, with geometry handled by JTS.
 *
 * Workspaces are keyed by their normalized path and datasets by name, ignoring case. A
 * folder that exists on disk is opened as an empty workspace on first use; any other
 * workspace must be created with {@link #createWorkspace(String)}. Single-file datasets
 * (sites.shp) also get an empty placeholder file when their folder exists, so that a
 * file-existence check sees them.
 *
 * Operations run one at a time on a single worker thread.
 */
public class InMemoryFeatureStore implements FeatureStore, AutoCloseable {

    private final MapSession session;
    private final Map<String, Map<String, Dataset>> workspaces = new LinkedHashMap<>();
    private final ExecutorService worker;
    private final GeoprocessingTools tools;

    public InMemoryFeatureStore(MapSession session) {
        this.session = session;
        this.tools = new GeoprocessingTools(this);
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "feature-store-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public MapSession getSession() {
        return session;
    }

    // Workspaces and datasets

    public synchronized void createWorkspace(String workspace) {
        workspaces.computeIfAbsent(DatasetPath.workspaceKey(workspace), k -> new LinkedHashMap<>());
        LoggingUtil.debug("Workspace created: " + workspace);
    }

    private Map<String, Dataset> findWorkspace(String workspace) {
        String key = DatasetPath.workspaceKey(workspace);
        Map<String, Dataset> datasets = workspaces.get(key);
        if (datasets == null && !key.isEmpty() && Files.isDirectory(Paths.get(key))) {
            datasets = new LinkedHashMap<>();
            workspaces.put(key, datasets);
        }
        return datasets;
    }

    private Map<String, Dataset> openWorkspace(String workspace) throws FeatureStoreException {
        Map<String, Dataset> datasets = findWorkspace(workspace);
        if (datasets == null) {
            throw new FeatureStoreException("Cannot open workspace " + workspace);
        }
        return datasets;
    }

    /**
     * Create (or replace) a dataset with the system fields plus the given fields.
     */
    public synchronized Dataset createDataset(DatasetPath path, DatasetKind kind, List<Field> fields)
            throws FeatureStoreException {
        Map<String, Dataset> datasets = openWorkspace(path.getWorkspace());
        Dataset dataset = new Dataset(path, kind);
        for (Field field : fields) {
            dataset.addField(field);
        }
        if (datasets.put(key(path), dataset) != null) {
            LoggingUtil.debug("Overwriting dataset " + path);
        }
        writePlaceholder(path);
        return dataset;
    }

    public synchronized Dataset getDataset(DatasetPath path) {
        Map<String, Dataset> datasets = findWorkspace(path.getWorkspace());
        return datasets == null ? null : datasets.get(key(path));
    }

    public synchronized boolean deleteDataset(DatasetPath path) throws FeatureStoreException {
        Map<String, Dataset> datasets = openWorkspace(path.getWorkspace());
        Dataset removed = datasets.remove(key(path));
        if (removed != null && path.isSingleFile()) {
            try {
                Files.deleteIfExists(path.toFilePath());
            } catch (IOException e) {
                throw new FeatureStoreException("Could not delete " + path + ": " + e.getMessage(), e);
            }
        }
        return removed != null;
    }

    private void writePlaceholder(DatasetPath path) throws FeatureStoreException {
        if (!path.isSingleFile() || !path.hasWorkspace()) {
            return;
        }
        Path folder = Paths.get(path.getWorkspace());
        if (!Files.isDirectory(folder)) {
            return;
        }
        try {
            Path file = path.toFilePath();
            if (!Files.exists(file)) {
                Files.createFile(file);
            }
        } catch (IOException e) {
            throw new FeatureStoreException("Could not write " + path + ": " + e.getMessage(), e);
        }
    }

    private static String key(DatasetPath path) {
        return path.getName().toLowerCase(Locale.ROOT);
    }

    // Name resolution

    /**
     * A dataset as seen through a layer name or a path, with the layer's selection if any.
     */
    static class Source {
        private final Dataset dataset;
        private final String layerName;
        private final Set<Long> selection;

        Source(Dataset dataset, String layerName, Set<Long> selection) {
            this.dataset = dataset;
            this.layerName = layerName;
            this.selection = selection;
        }

        Dataset getDataset() {
            return dataset;
        }

        String getLayerName() {
            return layerName;
        }

        FieldList getFields() {
            return dataset.getFields();
        }

        List<Row> getRows() {
            List<Row> rows = dataset.getRows();
            if (selection == null) {
                return rows;
            }
            List<Row> selected = new ArrayList<>();
            for (Row row : rows) {
                if (selection.contains(row.getObjectId())) {
                    selected.add(row);
                }
            }
            return selected;
        }
    }

    synchronized Source resolve(String name) throws DatasetNotFoundException {
        if (name == null || name.trim().isEmpty()) {
            throw new DatasetNotFoundException(String.valueOf(name));
        }
        MapSession.Entry layer = session.findLayer(name);
        if (layer != null) {
            Dataset dataset = getDataset(layer.getPath());
            if (dataset == null) {
                throw new DatasetNotFoundException(layer.getPath().getFullPath());
            }
            return new Source(dataset, layer.getName(), session.getSelection(layer.getName()));
        }
        MapSession.Entry table = session.findTable(name);
        if (table != null) {
            Dataset dataset = getDataset(table.getPath());
            if (dataset == null) {
                throw new DatasetNotFoundException(table.getPath().getFullPath());
            }
            return new Source(dataset, null, null);
        }
        Dataset dataset = getDataset(DatasetPath.parse(name));
        if (dataset == null) {
            throw new DatasetNotFoundException(name);
        }
        return new Source(dataset, null, null);
    }

    // FeatureStore

    @Override
    public synchronized boolean nameExists(String workspace, DatasetKind kind, String name)
            throws FeatureStoreException {
        Map<String, Dataset> datasets = openWorkspace(workspace);
        Dataset dataset = datasets.get(name.toLowerCase(Locale.ROOT));
        return dataset != null && (kind == null || dataset.getKind() == kind);
    }

    @Override
    public FieldList getFields(String dataset) throws DatasetNotFoundException {
        return resolve(dataset).getFields();
    }

    @Override
    public DatasetKind getKind(String dataset) throws DatasetNotFoundException {
        return resolve(dataset).getDataset().getKind();
    }

    @Override
    public GeometryKind sampleGeometryKind(String dataset) throws DatasetNotFoundException {
        Source source = resolve(dataset);
        if (source.getDataset().getKind() != DatasetKind.FEATURE_CLASS) {
            return GeometryKind.OTHER;
        }
        List<Row> rows = source.getDataset().getRows();
        return rows.isEmpty() ? GeometryKind.OTHER : GeometryKind.of(rows.get(0).getShape());
    }

    @Override
    public RowCursor search(String dataset) throws DatasetNotFoundException {
        Source source = resolve(dataset);
        List<Row> rows = new ArrayList<>();
        for (Row row : source.getRows()) {
            rows.add(row.copy());
        }
        return new RowCursor(source.getFields(), rows);
    }

    @Override
    public OperationHandle execute(OperationRequest request) {
        InMemoryOperation operation = new InMemoryOperation(request);
        operation.future = worker.submit(() -> perform(operation));
        return operation;
    }

    private void perform(InMemoryOperation operation) {
        if (!operation.transition(OperationStatus.NEW, OperationStatus.EXECUTING)) {
            return;
        }
        operation.addMessage("Executing " + operation.getRequest());
        try {
            tools.run(operation.getRequest(), operation::addMessage);
            operation.addMessage("Succeeded");
            operation.transition(OperationStatus.EXECUTING, OperationStatus.SUCCEEDED);
        } catch (FeatureStoreException | RuntimeException e) {
            operation.errorMessage = e.getMessage();
            operation.addMessage("ERROR: " + e.getMessage());
            operation.transition(OperationStatus.EXECUTING, OperationStatus.FAILED);
        }
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }

    private static class InMemoryOperation implements OperationHandle {
        private final OperationRequest request;
        private final List<String> messages = new CopyOnWriteArrayList<>();
        private OperationStatus status = OperationStatus.NEW;
        private volatile String errorMessage;
        private volatile Future<?> future;

        InMemoryOperation(OperationRequest request) {
            this.request = request;
        }

        synchronized boolean transition(OperationStatus from, OperationStatus to) {
            if (status != from) {
                return false;
            }
            status = to;
            return true;
        }

        void addMessage(String message) {
            messages.add(message);
        }

        @Override
        public OperationRequest getRequest() {
            return request;
        }

        @Override
        public synchronized OperationStatus getStatus() {
            return status;
        }

        @Override
        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public List<String> getMessages() {
            return new ArrayList<>(messages);
        }

        @Override
        public void cancel() {
            synchronized (this) {
                if (status.isTerminal()) {
                    return;
                }
                status = OperationStatus.CANCELLED;
            }
            addMessage("Cancelled");
            Future<?> running = future;
            if (running != null) {
                running.cancel(false);
            }
        }
    }
}
