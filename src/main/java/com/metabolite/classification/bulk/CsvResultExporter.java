package com.metabolite.classification.bulk;

import com.metabolite.classification.core.model.MergedRecord;
import com.metabolite.classification.core.model.ResultTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * CSV result exporter.
 *
 * <p>Output format:</p>
 * <pre>
 * metabolite,hmdb_id,super_class,...,final_type
 * Glucose,HMDB0000122,Organic oxygen compounds,...,primary
 * </pre>
 *
 * Multi-valued cells (pathways) are joined with {@code "; "}; absent cells are empty.
 */
public class CsvResultExporter implements ResultExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvResultExporter.class);

    static final String NAME_COLUMN = "metabolite";
    static final String LIST_SEPARATOR = "; ";

    private final boolean summaryOnly;

    public CsvResultExporter() {
        this(false);
    }

    /**
     * @param summaryOnly restrict output to the summary columns
     */
    public CsvResultExporter(boolean summaryOnly) {
        this.summaryOnly = summaryOnly;
    }

    @Override
    public ExportResult export(ResultTable table, OutputStream output) throws IOException {
        return export(table, new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    @Override
    public ExportResult export(ResultTable table, Writer writer) throws IOException {
        List<String> columns = summaryOnly ? table.displayColumns() : table.columns();
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));

        List<String> header = new ArrayList<>();
        header.add(NAME_COLUMN);
        header.addAll(columns);
        pw.println(joinRow(header));

        long rows = 0;
        for (MergedRecord record : table.records()) {
            Map<String, Object> values = record.toColumns();
            List<String> cells = new ArrayList<>();
            cells.add(record.metaboliteName());
            for (String column : columns) {
                cells.add(format(values.get(column)));
            }
            pw.println(joinRow(cells));
            rows++;
        }

        pw.flush();
        if (pw.checkError()) {
            throw new IOException("Failed writing CSV results");
        }
        ExportResult result = new ExportResult(rows, columns);
        log.info("export.completed format=csv result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> items) {
            List<String> parts = new ArrayList<>();
            for (Object item : items) {
                parts.add(String.valueOf(item));
            }
            return String.join(LIST_SEPARATOR, parts);
        }
        return value.toString();
    }

    private static String joinRow(List<String> cells) {
        List<String> escaped = new ArrayList<>(cells.size());
        for (String cell : cells) {
            escaped.add(csvEscape(cell));
        }
        return String.join(",", escaped);
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
