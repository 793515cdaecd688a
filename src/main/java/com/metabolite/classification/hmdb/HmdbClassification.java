package com.metabolite.classification.hmdb;

import java.util.List;

/**
 * Taxonomy and pathway data extracted from an HMDB metabolite document.
 *
 * @param superClass super class, "Unknown" when absent
 * @param className  class, "Unknown" when absent
 * @param subClass   sub class, "Unknown" when absent
 * @param pathways   pathway names, empty when the document lists none
 */
public record HmdbClassification(
        String superClass,
        String className,
        String subClass,
        List<String> pathways
) {
    public HmdbClassification {
        pathways = pathways != null ? List.copyOf(pathways) : List.of();
    }
}
