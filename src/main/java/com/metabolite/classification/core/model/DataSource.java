package com.metabolite.classification.core.model;

/**
 * External databases consulted by the pipeline.
 */
public enum DataSource {
    HMDB("HMDB"),
    KEGG("KEGG");

    private final String label;

    DataSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
