package com.metabolite.classification.classification;

import com.metabolite.classification.core.model.MetaboliteType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierTest {

    private final Classifier classifier = new Classifier();

    @Nested
    @DisplayName("KEGG precedence")
    class KeggPrecedence {

        @Test
        @DisplayName("KEGG secondary wins over a lipid super class")
        void keggSecondaryOverridesLipid() {
            assertEquals(MetaboliteType.SECONDARY,
                    classifier.classify(MetaboliteType.SECONDARY, "Lipids and lipid-like molecules"));
        }

        @Test
        @DisplayName("KEGG primary wins over a flavonoid super class")
        void keggPrimaryOverridesFlavonoid() {
            assertEquals(MetaboliteType.PRIMARY,
                    classifier.classify(MetaboliteType.PRIMARY, "Flavonoids"));
        }

        @Test
        @DisplayName("KEGG type is used even without any HMDB data")
        void keggWithoutHmdb() {
            assertEquals(MetaboliteType.PRIMARY, classifier.classify(MetaboliteType.PRIMARY, null));
        }
    }

    @Nested
    @DisplayName("Super class heuristic")
    class Heuristic {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "Lipids and lipid-like molecules, PRIMARY",
                "Organic acids and derivatives, PRIMARY",
                "Nucleosides; nucleotides; and analogues, PRIMARY",
                "Flavonoid glycoside, SECONDARY",
                "ALKALOIDS AND DERIVATIVES, SECONDARY",
                "Prenol lipids, PRIMARY",
                "Sesquiterpenes, SECONDARY",
                "Unknown, UNKNOWN",
                "Benzenoids, UNKNOWN"
        })
        void classifiesBySuperClass(String superClass, MetaboliteType expected) {
            assertEquals(expected, classifier.classify(null, superClass));
        }

        @Test
        @DisplayName("Primary keywords are checked before secondary ones")
        void primaryBeforeSecondary() {
            assertEquals(MetaboliteType.PRIMARY, classifier.classify(null, "Terpene lipids"));
        }

        @Test
        @DisplayName("No data at all is unknown")
        void nothing() {
            assertEquals(MetaboliteType.UNKNOWN, classifier.classify(null, null));
            assertEquals(MetaboliteType.UNKNOWN, classifier.classify(null, ""));
        }
    }
}
