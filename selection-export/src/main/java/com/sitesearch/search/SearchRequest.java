package com.sitesearch.search;

import com.sitesearch.util.SearchConfig.CombinedSitesOption;

import java.util.ArrayList;
import java.util.List;

/**
 * One data search: the site to search around, the buffer size and the layers to search.
 */
public class SearchRequest {
    private final String reference;
    private final String bufferSize;
    private String siteName = "";
    private List<String> layers = new ArrayList<>();
    private CombinedSitesOption combinedSitesOption;
    private boolean clearLogFile = false;

    public SearchRequest(String reference, String bufferSize) {
        this.reference = reference;
        this.bufferSize = bufferSize;
    }

    public String getReference() {
        return reference;
    }

    /** Buffer size in the configured buffer unit. */
    public String getBufferSize() {
        return bufferSize;
    }

    public String getSiteName() {
        return siteName;
    }

    /** Site name; when empty it is read from the search layer. */
    public SearchRequest setSiteName(String siteName) {
        this.siteName = siteName == null ? "" : siteName;
        return this;
    }

    public List<String> getLayers() {
        return layers;
    }

    /** Layers (by configuration name) to search; empty for all configured layers. */
    public SearchRequest setLayers(List<String> layers) {
        this.layers = new ArrayList<>(layers);
        return this;
    }

    public CombinedSitesOption getCombinedSitesOption() {
        return combinedSitesOption;
    }

    /** Overrides the configured combined sites option when set. */
    public SearchRequest setCombinedSitesOption(CombinedSitesOption combinedSitesOption) {
        this.combinedSitesOption = combinedSitesOption;
        return this;
    }

    public boolean isClearLogFile() {
        return clearLogFile;
    }

    public SearchRequest setClearLogFile(boolean clearLogFile) {
        this.clearLogFile = clearLogFile;
        return this;
    }

    @Override
    public String toString() {
        return reference + " (" + bufferSize + ")";
    }
}
