package com.metabolite.classification.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads metabolite names from the first column of a delimited file.
 *
 * <p>Expected format:</p>
 * <pre>
 * Metabolite,Sample
 * Glucose,S1
 * "Quercetin 3-O-glucoside, hydrate",S2
 * </pre>
 *
 * <p>The first line is a header row and is skipped. Blank lines are skipped; any other
 * value, including whitespace-only cells, is returned unchanged.</p>
 */
public class CsvNameImporter implements NameImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvNameImporter.class);

    private final char delimiter;

    public CsvNameImporter() {
        this(',');
    }

    public CsvNameImporter(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public List<String> readNames(InputStream input) throws IOException {
        return readNames(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    @Override
    public List<String> readNames(Reader reader) throws IOException {
        List<String> names = new ArrayList<>();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                return names;
            }

            String line;
            while ((line = br.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                names.add(parseFirstField(line));
            }
        }
        log.info("import.completed names={}", names.size());
        return names;
    }

    @Override
    public String getFormat() {
        return delimiter == '\t' ? "tsv" : "csv";
    }

    /**
     * Returns the first field of a line, handling quoted values with doubled quotes.
     */
    String parseFirstField(String line) {
        if (!line.startsWith("\"")) {
            int end = line.indexOf(delimiter);
            return end < 0 ? line : line.substring(0, end);
        }
        StringBuilder value = new StringBuilder();
        int i = 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"') {
                if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    value.append('"');
                    i += 2;
                    continue;
                }
                return value.toString();
            }
            value.append(c);
            i++;
        }
        // unterminated quote: take the rest of the line
        return value.toString();
    }
}
