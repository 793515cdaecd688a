package com.metabolite.classification.core.model;

import java.util.List;

/**
 * Column names of the result table.
 */
public final class ResultColumns {

    public static final String HMDB_ID = "hmdb_id";
    public static final String SUPER_CLASS = "super_class";
    public static final String CLASS = "class";
    public static final String SUB_CLASS = "sub_class";
    public static final String HMDB_PATHWAYS = "hmdb_pathways";
    public static final String HMDB_STATUS = "hmdb_status";

    public static final String KEGG_ID = "kegg_id";
    public static final String TYPE = "type";
    public static final String KEGG_PATHWAYS = "kegg_pathways";
    public static final String DESCRIPTION = "description";
    public static final String KEGG_STATUS = "kegg_status";

    public static final String FINAL_TYPE = "final_type";

    /**
     * Columns shown in the summary view, in display order.
     */
    public static final List<String> DISPLAY = List.of(
            FINAL_TYPE, SUPER_CLASS, HMDB_PATHWAYS, KEGG_PATHWAYS, HMDB_ID, KEGG_ID);

    private ResultColumns() {
    }
}
