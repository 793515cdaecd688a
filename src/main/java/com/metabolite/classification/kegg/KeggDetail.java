package com.metabolite.classification.kegg;

import com.metabolite.classification.core.model.MetaboliteType;

/**
 * Type and description read from a KEGG compound flat file.
 */
public record KeggDetail(MetaboliteType type, String description) {
}
