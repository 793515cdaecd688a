package com.metabolite.classification.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvNameImporterTest {

    private final CsvNameImporter importer = new CsvNameImporter();

    @Test
    @DisplayName("Should read the first column and skip the header row")
    void readsFirstColumn() throws IOException {
        String csv = """
                Metabolite,Sample
                Glucose,S1
                Quercetin,S2
                Citric acid
                """;

        assertEquals(List.of("Glucose", "Quercetin", "Citric acid"), importer.readNames(new StringReader(csv)));
    }

    @Test
    @DisplayName("Should handle quoted values with commas and doubled quotes")
    void quotedValues() throws IOException {
        String csv = "name\n\"Quercetin 3-O-glucoside, hydrate\",x\n\"5\"\"-AMP\"\n";

        assertEquals(List.of("Quercetin 3-O-glucoside, hydrate", "5\"-AMP"),
                importer.readNames(new StringReader(csv)));
    }

    @Test
    @DisplayName("Should keep duplicates and whitespace-only cells unchanged")
    void passThrough() throws IOException {
        String csv = "name\nGlucose\n  \n,S3\nGlucose\n";

        assertEquals(List.of("Glucose", "  ", "", "Glucose"), importer.readNames(new StringReader(csv)));
    }

    @Test
    @DisplayName("Should skip blank lines and accept an empty file")
    void blankLines() throws IOException {
        assertEquals(List.of("Glucose"), importer.readNames(new StringReader("name\n\nGlucose\n\n")));
        assertTrue(importer.readNames(new StringReader("")).isEmpty());
    }

    @Test
    @DisplayName("Should read tab-separated input as UTF-8")
    void tabSeparated() throws IOException {
        CsvNameImporter tsv = new CsvNameImporter('\t');
        byte[] bytes = "name\tid\nβ-Alanine\tHMDB0000056\n".getBytes(StandardCharsets.UTF_8);

        assertEquals(List.of("β-Alanine"), tsv.readNames(new ByteArrayInputStream(bytes)));
        assertEquals("tsv", tsv.getFormat());
    }
}
