package com.metabolite.classification.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One metabolite's combined HMDB and KEGG data plus its final classification.
 *
 * @param metaboliteName the caller-supplied name, used as-is as the row key
 * @param hmdb           HMDB side, never null
 * @param kegg           KEGG side, never null
 * @param finalType      the decided classification, never null
 */
public record MergedRecord(
        String metaboliteName,
        HmdbRecord hmdb,
        KeggRecord kegg,
        MetaboliteType finalType
) {
    public MergedRecord {
        Objects.requireNonNull(metaboliteName, "metaboliteName");
        hmdb = hmdb != null ? hmdb : HmdbRecord.absent();
        kegg = kegg != null ? kegg : KeggRecord.absent();
        Objects.requireNonNull(finalType, "finalType");
    }

    /**
     * HMDB columns overlaid with KEGG columns, then {@code final_type}.
     */
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>(hmdb.toColumns());
        columns.putAll(kegg.toColumns());
        columns.put(ResultColumns.FINAL_TYPE, finalType.getLabel());
        return columns;
    }
}
