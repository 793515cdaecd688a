package com.metabolite.classification.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HMDB side of a metabolite's record.
 * On anything but {@link SourceStatus.Kind#FOUND} all data fields are null.
 *
 * @param hmdbId     the resolved HMDB accession
 * @param superClass taxonomy super class, "Unknown" when HMDB has none
 * @param className  taxonomy class, "Unknown" when HMDB has none
 * @param subClass   taxonomy sub class, "Unknown" when HMDB has none
 * @param pathways   pathway names in document order
 * @param status     lookup status, null for a metabolite that was never queried
 */
public record HmdbRecord(
        String hmdbId,
        String superClass,
        String className,
        String subClass,
        List<String> pathways,
        SourceStatus status
) {
    public static final String UNKNOWN = "Unknown";

    private static final HmdbRecord ABSENT = new HmdbRecord(null, null, null, null, null, null);

    public HmdbRecord {
        pathways = pathways != null ? List.copyOf(pathways) : null;
    }

    public static HmdbRecord found(String hmdbId, String superClass, String className,
                                   String subClass, List<String> pathways) {
        return new HmdbRecord(hmdbId, superClass, className, subClass,
                pathways != null ? pathways : List.of(), SourceStatus.found());
    }

    public static HmdbRecord idNotFound() {
        return new HmdbRecord(null, null, null, null, null, SourceStatus.idNotFound());
    }

    public static HmdbRecord error(String message) {
        return new HmdbRecord(null, null, null, null, null, SourceStatus.error(message));
    }

    /**
     * A record with no fields at all, used when HMDB was never consulted for a name.
     */
    public static HmdbRecord absent() {
        return ABSENT;
    }

    /**
     * Present fields keyed by result column, in column order.
     */
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        putIfPresent(columns, ResultColumns.HMDB_ID, hmdbId);
        putIfPresent(columns, ResultColumns.SUPER_CLASS, superClass);
        putIfPresent(columns, ResultColumns.CLASS, className);
        putIfPresent(columns, ResultColumns.SUB_CLASS, subClass);
        putIfPresent(columns, ResultColumns.HMDB_PATHWAYS, pathways);
        putIfPresent(columns, ResultColumns.HMDB_STATUS, status != null ? status.label() : null);
        return columns;
    }

    private static void putIfPresent(Map<String, Object> columns, String key, Object value) {
        if (value != null) {
            columns.put(key, value);
        }
    }
}
