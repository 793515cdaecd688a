package com.metabolite.classification.bulk;

import java.util.List;

/**
 * Result of writing a result table.
 *
 * @param rows    number of metabolite rows written
 * @param columns data columns written, excluding the metabolite name column
 */
public record ExportResult(long rows, List<String> columns) {

    public ExportResult {
        columns = columns != null ? List.copyOf(columns) : List.of();
    }

    @Override
    public String toString() {
        return "ExportResult{rows=" + rows + ", columns=" + columns + '}';
    }
}
