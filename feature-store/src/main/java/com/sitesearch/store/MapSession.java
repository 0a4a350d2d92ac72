package com.sitesearch.store;

import java.util.*;

/**
 * The layers and tables currently loaded for a search, with each layer's selection.
 *
 * The same name may be loaded more than once; lookups return the first match and
 * removals remove one entry at a time, so callers wanting all gone re-query until
 * nothing matches.
 */
public class MapSession {

    /** A loaded layer or standalone table. */
    public static class Entry {
        private final String name;
        private final DatasetPath path;
        private final DatasetKind kind;
        private Set<Long> selection = null;

        Entry(String name, DatasetPath path, DatasetKind kind) {
            this.name = name;
            this.path = path;
            this.kind = kind;
        }

        public String getName() {
            return name;
        }

        public DatasetPath getPath() {
            return path;
        }

        public DatasetKind getKind() {
            return kind;
        }

        @Override
        public String toString() {
            return name + " -> " + path;
        }
    }

    private final List<Entry> layers = new ArrayList<>();
    private final List<Entry> tables = new ArrayList<>();

    public synchronized Entry addLayer(String name, DatasetPath path) {
        Entry entry = new Entry(name, path, DatasetKind.FEATURE_CLASS);
        layers.add(entry);
        return entry;
    }

    public synchronized Entry addTable(String name, DatasetPath path) {
        Entry entry = new Entry(name, path, DatasetKind.TABLE);
        tables.add(entry);
        return entry;
    }

    public synchronized Entry findLayer(String name) {
        return find(layers, name);
    }

    public synchronized Entry findTable(String name) {
        return find(tables, name);
    }

    public synchronized boolean isLayerLoaded(String name) {
        return find(layers, name) != null;
    }

    public synchronized boolean isTableLoaded(String name) {
        return find(tables, name) != null;
    }

    /**
     * Remove the first layer with this name.
     *
     * @return true if a layer was removed
     */
    public synchronized boolean removeLayer(String name) {
        return layers.remove(find(layers, name));
    }

    public synchronized boolean removeTable(String name) {
        return tables.remove(find(tables, name));
    }

    public synchronized List<String> getLayerNames() {
        List<String> names = new ArrayList<>();
        for (Entry entry : layers) {
            names.add(entry.getName());
        }
        return names;
    }

    public synchronized List<String> getTableNames() {
        List<String> names = new ArrayList<>();
        for (Entry entry : tables) {
            names.add(entry.getName());
        }
        return names;
    }

    /**
     * Selected object ids of a layer, or null when nothing is selected.
     */
    public synchronized Set<Long> getSelection(String layerName) {
        Entry entry = find(layers, layerName);
        if (entry == null || entry.selection == null) {
            return null;
        }
        return new LinkedHashSet<>(entry.selection);
    }

    public synchronized void setSelection(String layerName, Collection<Long> objectIds) {
        Entry entry = requireLayer(layerName);
        entry.selection = new LinkedHashSet<>(objectIds);
    }

    public synchronized void clearSelection(String layerName) {
        requireLayer(layerName).selection = null;
    }

    public synchronized int getSelectionCount(String layerName) {
        Entry entry = find(layers, layerName);
        return entry == null || entry.selection == null ? 0 : entry.selection.size();
    }

    private Entry requireLayer(String layerName) {
        Entry entry = find(layers, layerName);
        if (entry == null) {
            throw new IllegalArgumentException("Layer " + layerName + " is not loaded");
        }
        return entry;
    }

    private static Entry find(List<Entry> entries, String name) {
        if (name == null) {
            return null;
        }
        for (Entry entry : entries) {
            if (entry.getName().equalsIgnoreCase(name)) {
                return entry;
            }
        }
        return null;
    }
}
