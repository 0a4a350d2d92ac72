package com.sitesearch.store;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Workspace location plus dataset name.
 *
 * A name whose fourth-from-last character is a dot (sites.shp, stats.dbf) is a
 * single-file dataset living directly in a folder. A workspace ending in ".sde" is a
 * remote database connection.
 */
public final class DatasetPath {
    private final String workspace;
    private final String name;

    private DatasetPath(String workspace, String name) {
        this.workspace = workspace;
        this.name = name;
    }

    public static DatasetPath of(String workspace, String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Dataset name is required");
        }
        return new DatasetPath(workspace == null ? "" : workspace, name.trim());
    }

    /**
     * Split a full path at its last separator (either slash style).
     */
    public static DatasetPath parse(String fullPath) {
        if (fullPath == null || fullPath.trim().isEmpty()) {
            throw new IllegalArgumentException("Dataset path is required");
        }
        String path = fullPath.trim();
        int split = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (split < 0) {
            return new DatasetPath("", path);
        }
        return new DatasetPath(path.substring(0, split), path.substring(split + 1));
    }

    public String getWorkspace() {
        return workspace;
    }

    public String getName() {
        return name;
    }

    public boolean hasWorkspace() {
        return !workspace.isEmpty();
    }

    public boolean isSingleFile() {
        return name.length() > 4 && name.charAt(name.length() - 4) == '.';
    }

    public boolean isRemoteWorkspace() {
        return workspace.toLowerCase(Locale.ROOT).endsWith(".sde");
    }

    /**
     * Dataset name without a single-file extension; this is the name a copy is
     * given when it is added to the session.
     */
    public String getBaseName() {
        return isSingleFile() ? name.substring(0, name.length() - 4) : name;
    }

    public Path toFilePath() {
        return hasWorkspace() ? Paths.get(workspace, name) : Paths.get(name);
    }

    public String getFullPath() {
        return toFilePath().toString();
    }

    /**
     * Key under which the workspace is registered, normalized so that different
     * spellings of the same folder match.
     */
    public static String workspaceKey(String workspace) {
        if (workspace == null || workspace.isEmpty()) {
            return "";
        }
        return Paths.get(workspace).toAbsolutePath().normalize().toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DatasetPath)) {
            return false;
        }
        DatasetPath that = (DatasetPath) other;
        return workspaceKey(workspace).equals(workspaceKey(that.workspace))
                && name.equalsIgnoreCase(that.name);
    }

    @Override
    public int hashCode() {
        return workspaceKey(workspace).hashCode() * 31 + name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return getFullPath();
    }
}
