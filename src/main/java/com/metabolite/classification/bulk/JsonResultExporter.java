package com.metabolite.classification.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.metabolite.classification.core.model.MergedRecord;
import com.metabolite.classification.core.model.ResultTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON result exporter: one object keyed by metabolite name, rows in table order.
 *
 * <pre>
 * {
 *   "Glucose" : {
 *     "hmdb_id" : "HMDB0000122",
 *     "kegg_pathways" : [ "map00010", "map00500" ],
 *     "final_type" : "primary"
 *   }
 * }
 * </pre>
 *
 * Absent fields are omitted from a row.
 */
public class JsonResultExporter implements ResultExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonResultExporter.class);

    private final boolean summaryOnly;
    private final ObjectMapper objectMapper;

    public JsonResultExporter() {
        this(false);
    }

    public JsonResultExporter(boolean summaryOnly) {
        this.summaryOnly = summaryOnly;
        this.objectMapper = new ObjectMapper();
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ExportResult export(ResultTable table, OutputStream output) throws IOException {
        return export(table, new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    @Override
    public ExportResult export(ResultTable table, Writer writer) throws IOException {
        List<String> columns = summaryOnly ? table.displayColumns() : table.columns();

        Map<String, Map<String, Object>> document = new LinkedHashMap<>();
        for (MergedRecord record : table.records()) {
            Map<String, Object> values = record.toColumns();
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                if (values.containsKey(column)) {
                    row.put(column, values.get(column));
                }
            }
            document.put(record.metaboliteName(), row);
        }

        writer.write(objectMapper.writeValueAsString(document));
        writer.flush();

        ExportResult result = new ExportResult(document.size(), columns);
        log.info("export.completed format=json result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
