package com.metabolite.classification.bulk;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.List;

/**
 * Reads the ordered list of metabolite names a pipeline run starts from.
 */
public interface NameImporter {

    List<String> readNames(InputStream input) throws IOException;

    List<String> readNames(Reader reader) throws IOException;

    /**
     * Returns the format supported by this importer (e.g., "csv").
     */
    String getFormat();
}
