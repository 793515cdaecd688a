package com.metabolite.classification.classification;

import com.metabolite.classification.core.model.MetaboliteType;

import java.util.List;
import java.util.Locale;

/**
 * Decides the final type of a metabolite.
 *
 * <ol>
 *   <li>An explicit KEGG type is taken verbatim.</li>
 *   <li>Otherwise a super class containing "lipid", "organic acid" or "nucleoside"
 *       (case-insensitive) is primary.</li>
 *   <li>Otherwise a super class containing "flavonoid", "alkaloid" or "terpene" is secondary.</li>
 *   <li>Anything else is unknown.</li>
 * </ol>
 *
 * The keyword lists are substring tests, not a taxonomy lookup.
 */
public class Classifier {

    static final List<String> PRIMARY_KEYWORDS = List.of("lipid", "organic acid", "nucleoside");
    static final List<String> SECONDARY_KEYWORDS = List.of("flavonoid", "alkaloid", "terpene");

    /**
     * @param keggType   the KEGG type, null when KEGG gave none
     * @param superClass the HMDB super class, null when HMDB gave none
     * @return never null
     */
    public MetaboliteType classify(MetaboliteType keggType, String superClass) {
        if (keggType != null) {
            return keggType;
        }
        String normalized = superClass != null ? superClass.toLowerCase(Locale.ROOT) : "";
        if (containsAny(normalized, PRIMARY_KEYWORDS)) {
            return MetaboliteType.PRIMARY;
        }
        if (containsAny(normalized, SECONDARY_KEYWORDS)) {
            return MetaboliteType.SECONDARY;
        }
        return MetaboliteType.UNKNOWN;
    }

    private static boolean containsAny(String value, List<String> keywords) {
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
