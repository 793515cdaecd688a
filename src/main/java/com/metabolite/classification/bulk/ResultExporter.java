package com.metabolite.classification.bulk;

import com.metabolite.classification.core.model.ResultTable;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;

/**
 * Writes a {@link ResultTable} in a specific format.
 */
public interface ResultExporter {

    ExportResult export(ResultTable table, OutputStream output) throws IOException;

    /**
     * Writes the table; the writer is flushed but not closed.
     */
    ExportResult export(ResultTable table, Writer writer) throws IOException;

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
