package com.sitesearch.export;

import com.sitesearch.store.*;
import com.sitesearch.util.LoggingUtil;

import java.util.*;

/**
 * Tracks temporary datasets created during an export and removes them on close, whether
 * or not the export succeeded.
 *
 * For each tracked path the session layers and tables carrying its name are removed one
 * at a time, looking the name up again after each removal, before the dataset itself is
 * deleted. Problems are logged as warnings only. Closing a second time does nothing.
 */
public class TemporaryResources implements AutoCloseable {
    private final MapSession session;
    private final SchemaValidator validator;
    private final OperationRunner runner;
    private final Set<String> tracked = new LinkedHashSet<>();
    private boolean closed = false;

    public TemporaryResources(MapSession session, SchemaValidator validator, OperationRunner runner) {
        this.session = session;
        this.validator = validator;
        this.runner = runner;
    }

    public TemporaryResources track(String... paths) {
        for (String path : paths) {
            if (path != null && !path.trim().isEmpty()) {
                tracked.add(path);
            }
        }
        return this;
    }

    public Set<String> getTracked() {
        return Collections.unmodifiableSet(tracked);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (String path : tracked) {
            remove(path);
        }
    }

    private void remove(String fullPath) {
        String name;
        try {
            name = DatasetPath.parse(fullPath).getBaseName();
        } catch (IllegalArgumentException e) {
            LoggingUtil.warn("Cannot clean up " + fullPath + ": " + e.getMessage());
            return;
        }

        try {
            int layers = 0;
            while (session.removeLayer(name)) {
                layers++;
            }
            int tables = 0;
            while (session.removeTable(name)) {
                tables++;
            }
            if (layers + tables > 0) {
                LoggingUtil.debug("Removed " + layers + " layer(s) and " + tables + " table(s) named " + name);
            }

            if (validator.exists(fullPath)) {
                runner.run(EngineOperation.DELETE, fullPath);
                LoggingUtil.debug("Deleted temporary dataset " + fullPath);
            }
        } catch (FeatureStoreException | RuntimeException e) {
            // the remaining paths are still cleaned up
            LoggingUtil.warn("Could not delete temporary dataset " + fullPath + ": " + e);
        }
    }
}
