package com.metabolite.classification.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * KEGG side of a metabolite's record.
 *
 * @param keggId      the resolved KEGG compound id (without the {@code cpd:} prefix)
 * @param type        primary or secondary, null when KEGG gave no type
 * @param pathways    unique pathway codes in first-seen order
 * @param description second line of the compound flat file, may be empty
 * @param status      lookup status, null for a metabolite that was never queried
 */
public record KeggRecord(
        String keggId,
        MetaboliteType type,
        Set<String> pathways,
        String description,
        SourceStatus status
) {
    private static final KeggRecord ABSENT = new KeggRecord(null, null, null, null, null);

    public KeggRecord {
        if (type == MetaboliteType.UNKNOWN) {
            throw new IllegalArgumentException("KEGG type is either primary or secondary");
        }
        pathways = pathways != null ? Collections.unmodifiableSet(new LinkedHashSet<>(pathways)) : null;
    }

    public static KeggRecord found(String keggId, MetaboliteType type, Set<String> pathways, String description) {
        return new KeggRecord(keggId, type, pathways != null ? pathways : Set.of(),
                description != null ? description : "", SourceStatus.found());
    }

    public static KeggRecord idNotFound() {
        return new KeggRecord(null, null, null, null, SourceStatus.idNotFound());
    }

    public static KeggRecord error(String message) {
        return new KeggRecord(null, null, null, null, SourceStatus.error(message));
    }

    public static KeggRecord absent() {
        return ABSENT;
    }

    /**
     * Present fields keyed by result column, in column order.
     */
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        if (keggId != null) {
            columns.put(ResultColumns.KEGG_ID, keggId);
        }
        if (type != null) {
            columns.put(ResultColumns.TYPE, type.getLabel());
        }
        if (pathways != null) {
            columns.put(ResultColumns.KEGG_PATHWAYS, pathways);
        }
        if (description != null) {
            columns.put(ResultColumns.DESCRIPTION, description);
        }
        if (status != null) {
            columns.put(ResultColumns.KEGG_STATUS, status.label());
        }
        return columns;
    }
}
